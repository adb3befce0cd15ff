package com.labyrinth.model;

import com.labyrinth.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the actions a hero applies to itself and others.
 */
class HeroTest {

    private Labyrinth labyrinth;
    private Hero hero;

    @BeforeEach
    void setUp() {
        labyrinth = Fixtures.classicLabyrinth();
        hero = Fixtures.hero("Arthur");
    }

    @Test
    @DisplayName("new hero starts with full health, three self-heals and no key")
    void shouldStartWithDefaults() {
        assertEquals(5, hero.getHealth());
        assertEquals(3, hero.getRemainingSelfHeals());
        assertFalse(hero.isCarryingKey());
        assertEquals(Fixtures.START, hero.getPosition());
        assertEquals(Coordinate.of(0, 0), hero.getPreviousPosition());
    }

    @Test
    @DisplayName("attack() takes exactly one health from the target")
    void shouldDamageTarget() {
        Hero target = Fixtures.hero("Bors");
        hero.attack(target);

        assertEquals(4, target.getHealth());
        assertEquals(5, hero.getHealth());
    }

    @Test
    @DisplayName("health at or below zero means dead")
    void shouldTreatNonPositiveHealthAsDead() {
        hero.setHealth(1);
        hero.takeDamage(2);

        assertEquals(-1, hero.getHealth());
        assertFalse(hero.isAlive());
    }

    @Nested
    @DisplayName("selfHeal()")
    class SelfHealTests {

        @Test
        @DisplayName("heals one point and spends a charge")
        void shouldHealOnePoint() {
            hero.setHealth(3);

            assertTrue(hero.selfHeal());
            assertEquals(4, hero.getHealth());
            assertEquals(2, hero.getRemainingSelfHeals());
        }

        @Test
        @DisplayName("does nothing at full health")
        void shouldNotHealAtFullHealth() {
            assertFalse(hero.selfHeal());
            assertEquals(5, hero.getHealth());
            assertEquals(3, hero.getRemainingSelfHeals());
        }

        @Test
        @DisplayName("does nothing without charges")
        void shouldNotHealWithoutCharges() {
            hero.setHealth(2);
            hero.setRemainingSelfHeals(0);

            assertFalse(hero.selfHeal());
            assertEquals(2, hero.getHealth());
        }
    }

    @Nested
    @DisplayName("healAtStation()")
    class HealAtStationTests {

        @Test
        @DisplayName("restores full health on a heart")
        void shouldRestoreFullHealth() {
            hero.setPosition(Fixtures.HEART);
            hero.setHealth(1);

            assertTrue(hero.healAtStation(labyrinth));
            assertEquals(Hero.MAX_HEALTH, hero.getHealth());
        }

        @Test
        @DisplayName("is not applicable at full health")
        void shouldNotApplyAtFullHealth() {
            hero.setPosition(Fixtures.HEART);

            assertFalse(hero.healAtStation(labyrinth));
        }

        @Test
        @DisplayName("is not applicable away from a heart")
        void shouldNotApplyAwayFromHeart() {
            hero.setHealth(2);

            assertFalse(hero.healAtStation(labyrinth));
            assertEquals(2, hero.getHealth());
        }
    }

    @Nested
    @DisplayName("pickUpKey()")
    class PickUpKeyTests {

        @Test
        @DisplayName("takes the key from the labyrinth")
        void shouldTakeKey() {
            hero.setPosition(Fixtures.KEY);

            assertTrue(hero.pickUpKey(labyrinth));
            assertTrue(hero.isCarryingKey());
            assertFalse(labyrinth.isKeyPresent());
        }

        @Test
        @DisplayName("fails when the key is elsewhere")
        void shouldFailAwayFromKey() {
            assertFalse(hero.pickUpKey(labyrinth));
            assertFalse(hero.isCarryingKey());
            assertTrue(labyrinth.isKeyPresent());
        }
    }

    @Nested
    @DisplayName("relocate()")
    class RelocateTests {

        @Test
        @DisplayName("remembers the departure cell when asked")
        void shouldRememberDeparture() {
            hero.relocate(Coordinate.of(3, 1), true);

            assertEquals(Coordinate.of(3, 1), hero.getPosition());
            assertEquals(Fixtures.START, hero.getPreviousPosition());
        }

        @Test
        @DisplayName("keeps the old previous position otherwise")
        void shouldKeepPreviousPosition() {
            hero.relocate(Coordinate.of(3, 1), false);

            assertEquals(Coordinate.of(0, 0), hero.getPreviousPosition());
        }
    }

    @Test
    @DisplayName("heroes are equal by name")
    void shouldCompareByName() {
        Hero twin = Fixtures.heroAt("Arthur", Fixtures.HEART);
        twin.setHealth(1);

        assertEquals(hero, twin);
        assertNotEquals(hero, Fixtures.hero("Bors"));
    }
}
