package com.arenahub.gameservice.interfaces.http;

import com.arenahub.gameservice.common.SessionNotFoundException;
import com.arenahub.gameservice.engine.core.ActionResult;
import com.arenahub.gameservice.engine.core.EngineMode;
import com.arenahub.gameservice.engine.core.GameState;
import com.arenahub.gameservice.engine.state.SumoState;
import com.arenahub.gameservice.interfaces.http.dto.CatalogEntry;
import com.arenahub.gameservice.interfaces.http.dto.SessionView;
import com.arenahub.gameservice.service.GameSessionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(GameRestController.class)
class GameRestControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private GameSessionService svc;

    @Test
    void catalogIsWrappedInTheEnvelope() throws Exception {
        when(svc.catalog()).thenReturn(List.of(new CatalogEntry("sumo", "相扑", EngineMode.TURN_BASED, 1, 2)));

        mvc.perform(get("/api/games/catalog"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data[0].slug").value("sumo"))
                .andExpect(jsonPath("$.data[0].maxPlayers").value(2));
    }

    @Test
    void createPassesGamePlayersAndConfigThrough() throws Exception {
        GameState st = new GameState(0, "tachiai", new SumoState());
        when(svc.create(eq("sumo"), eq(List.of("p1", "p2")), anyMap()))
                .thenReturn(new SessionView("s-1", "sumo", List.of("p1", "p2"), st, false, null, Map.of(), List.of()));

        mvc.perform(post("/api/games/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"game\":\"sumo\",\"playerIds\":[\"p1\",\"p2\"],\"config\":{\"ringSize\":4}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.sessionId").value("s-1"))
                .andExpect(jsonPath("$.data.state.data.module").value("sumo"));
    }

    @Test
    void missingPlayersFailsValidation() throws Exception {
        mvc.perform(post("/api/games/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"game\":\"sumo\",\"playerIds\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(400));
    }

    @Test
    void illegalArgumentBecomes400() throws Exception {
        when(svc.create(eq("chess"), anyList(), any())).thenThrow(new IllegalArgumentException("未知游戏: chess"));

        mvc.perform(post("/api/games/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"game\":\"chess\",\"playerIds\":[\"p1\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("未知游戏: chess"));
    }

    @Test
    void unknownSessionIs404() throws Exception {
        when(svc.get("nope")).thenThrow(new SessionNotFoundException("nope"));

        mvc.perform(get("/api/games/sessions/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value(404));
    }

    @Test
    void ruleRejectionIsStillA200() throws Exception {
        when(svc.act(eq("s-1"), eq("p2"), eq("push"), any())).thenReturn(ActionResult.fail("还没轮到你（当前行动者 p1）"));

        mvc.perform(post("/api/games/sessions/s-1/actions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"playerId\":\"p2\",\"type\":\"push\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.success").value(false))
                .andExpect(jsonPath("$.data.error").value("还没轮到你（当前行动者 p1）"));
    }

    @Test
    void brokenSnapshotIs409() throws Exception {
        when(svc.view("s-1", "p1")).thenThrow(new IllegalStateException("快照无法恢复: s-1"));

        mvc.perform(get("/api/games/sessions/s-1/view").param("playerId", "p1"))
                .andExpect(status().isConflict());
    }

    @Test
    void deleteDelegates() throws Exception {
        mvc.perform(delete("/api/games/sessions/s-1")).andExpect(status().isOk());
        verify(svc).delete("s-1");

        doThrow(new SessionNotFoundException("s-2")).when(svc).delete("s-2");
        mvc.perform(delete("/api/games/sessions/s-2")).andExpect(status().isNotFound());
    }
}
