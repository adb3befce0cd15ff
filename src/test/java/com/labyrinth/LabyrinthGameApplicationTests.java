package com.labyrinth;

import com.labyrinth.config.LabyrinthLoader;
import com.labyrinth.service.TurnEngine;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest(properties = "labyrinth.console.enabled=false")
class LabyrinthGameApplicationTests {

    @Autowired private LabyrinthLoader labyrinthLoader;
    @Autowired private TurnEngine turnEngine;

    @Test
    void contextLoads() {
        assertNotNull(turnEngine);
        assertNotNull(labyrinthLoader.getLayout("classic"));
    }

    @Test
    void mainMethodRunsSuccessfully() {
        // Keep the console runner from waiting on stdin
        LabyrinthGameApplication.main(new String[]{"--labyrinth.console.enabled=false"});
    }
}
