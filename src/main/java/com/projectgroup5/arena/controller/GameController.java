package com.projectgroup5.arena.controller;

import com.projectgroup5.arena.dto.CreateGameRequest;
import com.projectgroup5.arena.dto.FireRequest;
import com.projectgroup5.arena.dto.GameDescriptionDto;
import com.projectgroup5.arena.dto.GameStateDto;
import com.projectgroup5.arena.dto.JoinGameRequest;
import com.projectgroup5.arena.dto.MoveRequest;
import com.projectgroup5.arena.dto.PlayerTicketDto;
import com.projectgroup5.arena.game.Position;
import com.projectgroup5.arena.game.Shape;
import com.projectgroup5.arena.service.GameService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/games")
@CrossOrigin(origins = "*")
public class GameController {

    private final GameService gameService;

    public GameController(GameService gameService) {
        this.gameService = gameService;
    }

    // 获取所有活跃游戏及玩家名
    @GetMapping
    public ResponseEntity<List<GameDescriptionDto>> listGames() {
        return ResponseEntity.ok(gameService.listGames());
    }

    // 创建游戏，调用方成为第一个玩家
    @PostMapping
    public ResponseEntity<?> createGame(@RequestBody CreateGameRequest request) {
        if (isBlank(request.getGameName()) || isBlank(request.getPlayerName())) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body("gameName and playerName are required");
        }
        PlayerTicketDto ticket = gameService.create(request.getGameName(), request.getPlayerName());
        return ResponseEntity.status(HttpStatus.CREATED).body(ticket);
    }

    @PostMapping("/{gameId}/players")
    public ResponseEntity<?> joinGame(@PathVariable("gameId") long gameId,
                                      @RequestBody JoinGameRequest request) {
        if (isBlank(request.getPlayerName())) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body("playerName is required");
        }
        PlayerTicketDto ticket = gameService.join(gameId, request.getPlayerName());
        return ResponseEntity.status(HttpStatus.CREATED).body(ticket);
    }

    @GetMapping("/{gameId}")
    public ResponseEntity<GameDescriptionDto> describeGame(@PathVariable("gameId") long gameId) {
        return ResponseEntity.ok(gameService.describe(gameId));
    }

    /**
     * 获取某个玩家当前视野内的游戏状态
     */
    @GetMapping("/{gameId}/state")
    public ResponseEntity<GameStateDto> getState(@PathVariable("gameId") long gameId,
                                                 @RequestParam("playerId") int playerId) {
        return ResponseEntity.ok(gameService.getState(gameId, playerId));
    }

    /**
     * Every entity of the game as a plain circle, for debugging and map views.
     */
    @GetMapping("/{gameId}/shapes")
    public ResponseEntity<List<Shape>> getShapes(@PathVariable("gameId") long gameId) {
        return ResponseEntity.ok(gameService.shapes(gameId));
    }

    @PostMapping("/{gameId}/move")
    public ResponseEntity<?> move(@PathVariable("gameId") long gameId,
                                  @RequestBody MoveRequest request) {
        if (request.getPlayerId() == null || request.getX() == null || request.getY() == null) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body("playerId, x and y are required");
        }
        boolean moved = gameService.move(gameId, request.getPlayerId(),
                new Position(request.getX(), request.getY()));
        return ResponseEntity.ok(Map.of("moved", moved));
    }

    /**
     * 开火，可指定目标点（否则沿玩家朝向）
     */
    @PostMapping("/{gameId}/fire")
    public ResponseEntity<?> fire(@PathVariable("gameId") long gameId,
                                  @RequestBody FireRequest request) {
        if (request.getPlayerId() == null || request.getGunId() == null) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body("playerId and gunId are required");
        }
        Position aim = null;
        if (request.getTargetX() != null && request.getTargetY() != null) {
            aim = new Position(request.getTargetX(), request.getTargetY());
        }
        List<Integer> bullets = gameService.fire(gameId, request.getPlayerId(), request.getGunId(), aim);
        return ResponseEntity.ok(Map.of("bullets", bullets));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
