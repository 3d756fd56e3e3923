package com.arenahub.gameservice.service;

import com.arenahub.gameservice.engine.core.ActionResult;
import com.arenahub.gameservice.engine.core.GameState;
import com.arenahub.gameservice.interfaces.http.dto.CatalogEntry;
import com.arenahub.gameservice.interfaces.http.dto.SessionView;

import java.util.List;
import java.util.Map;

public interface GameSessionService {

    /** 可创建的游戏列表 */
    List<CatalogEntry> catalog();

    /** 新建会话并初始化对局；未知游戏、人数越界、配置非法时抛 IllegalArgumentException */
    SessionView create(String game, List<String> playerIds, Map<String, Object> config);

    /** 完整状态（不做投影） */
    SessionView get(String sessionId);

    /** 某玩家视角的投影状态 */
    GameState view(String sessionId, String playerId);

    /**
     * 提交一条动作。规则失败以 success=false 返回，不抛异常；
     * 只有成功的动作才会写快照。
     */
    ActionResult act(String sessionId, String playerId, String type, Map<String, Object> payload);

    void delete(String sessionId);
}
