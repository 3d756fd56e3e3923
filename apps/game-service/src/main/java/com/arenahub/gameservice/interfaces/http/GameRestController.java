package com.arenahub.gameservice.interfaces.http;

import com.arenahub.gameservice.engine.core.ActionResult;
import com.arenahub.gameservice.engine.core.GameState;
import com.arenahub.gameservice.interfaces.http.dto.ActionRequest;
import com.arenahub.gameservice.interfaces.http.dto.CatalogEntry;
import com.arenahub.gameservice.interfaces.http.dto.CreateSessionRequest;
import com.arenahub.gameservice.interfaces.http.dto.SessionView;
import com.arenahub.gameservice.service.GameSessionService;
import com.arenahub.web.common.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 游戏会话 http 接口。
 * 只做参数搬运与响应包装，规则全部在内核与游戏模块里。
 */
@RestController
@RequestMapping("/api/games")
@RequiredArgsConstructor
public class GameRestController {

    private final GameSessionService svc;

    /** 可创建的游戏列表 */
    @GetMapping("/catalog")
    public ResponseEntity<ApiResponse<List<CatalogEntry>>> catalog() {
        return ResponseEntity.ok(ApiResponse.success(svc.catalog()));
    }

    /**
     * 新建会话：
     *  game 为模块 slug；config 缺省时使用 arena.games.defaults，未给 seed 时自动生成。
     *  返回值携带初始化阶段的事件（game_started、首回合开始等）。
     */
    @PostMapping("/sessions")
    public ResponseEntity<ApiResponse<SessionView>> create(@Valid @RequestBody CreateSessionRequest req) {
        SessionView view = svc.create(req.getGame(), req.getPlayerIds(), req.getConfig());
        return ResponseEntity.ok(ApiResponse.success(view));
    }

    /** 完整状态，调试与观战用 */
    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<ApiResponse<SessionView>> get(@PathVariable String sessionId) {
        return ResponseEntity.ok(ApiResponse.success(svc.get(sessionId)));
    }

    /** 指定玩家视角（战争迷雾） */
    @GetMapping("/sessions/{sessionId}/view")
    public ResponseEntity<ApiResponse<GameState>> view(@PathVariable String sessionId,
                                                       @RequestParam("playerId") String playerId) {
        return ResponseEntity.ok(ApiResponse.success(svc.view(sessionId, playerId)));
    }

    /**
     * 提交动作。
     * 规则层面的失败（未轮到你、弹药不足等）同样返回 200，success=false 与原因放在 data 里。
     */
    @PostMapping("/sessions/{sessionId}/actions")
    public ResponseEntity<ApiResponse<ActionResult>> act(@PathVariable String sessionId,
                                                         @Valid @RequestBody ActionRequest req) {
        ActionResult result = svc.act(sessionId, req.getPlayerId(), req.getType(), req.getPayload());
        return ResponseEntity.ok(ApiResponse.success(result));
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable String sessionId) {
        svc.delete(sessionId);
        return ResponseEntity.ok(ApiResponse.success());
    }
}
