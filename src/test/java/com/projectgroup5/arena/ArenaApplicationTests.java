package com.projectgroup5.arena;

import com.projectgroup5.arena.dto.GameStateDto;
import com.projectgroup5.arena.dto.PlayerTicketDto;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots the whole server and drives one game over HTTP while the tick loop runs.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {"arena.seed=2024", "arena.tick-millis=5"})
class ArenaApplicationTests {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void createdGameIsTicked() throws Exception {
        ResponseEntity<PlayerTicketDto> created = restTemplate.postForEntity("/api/games",
                Map.of("gameName", "boot", "playerName", "alice"), PlayerTicketDto.class);
        assertEquals(HttpStatus.CREATED, created.getStatusCode());
        PlayerTicketDto ticket = created.getBody();
        assertNotNull(ticket);

        String stateUrl = "/api/games/" + ticket.getGameId() + "/state?playerId=" + ticket.getPlayerId();
        long firstTick = restTemplate.getForObject(stateUrl, GameStateDto.class).getTick();

        long deadline = System.currentTimeMillis() + 5000;
        long tick = firstTick;
        while (tick <= firstTick && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
            tick = restTemplate.getForObject(stateUrl, GameStateDto.class).getTick();
        }
        assertTrue(tick > firstTick);
    }
}
