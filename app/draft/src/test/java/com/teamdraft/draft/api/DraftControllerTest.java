/*
 * どこで: Draft API の Web 層テスト
 * 何を: アクションの受け渡し、入力検証、エラーコードと HTTP ステータスの対応を検証する
 * なぜ: チャット連携側がエラーコードだけで利用者向けの返答を決められるようにするため
 */
package com.teamdraft.draft.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.teamdraft.draft.api.response.AvailableTeamsResponse;
import com.teamdraft.draft.api.response.DraftActionResponse;
import com.teamdraft.draft.model.DraftAction;
import com.teamdraft.draft.model.TeamHolder;
import com.teamdraft.draft.model.TeamSource;
import com.teamdraft.draft.service.DraftOrchestrator;
import com.teamdraft.draft.service.DraftQueryService;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(DraftController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class DraftControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private DraftOrchestrator orchestrator;
  @MockitoBean private DraftQueryService queryService;

  @Test
  void pickIsForwardedAsMakePickAction() throws Exception {
    when(orchestrator.submitAction(7L, 42L, new DraftAction.MakePick("Iowa"), "trace-9"))
        .thenReturn(
            new DraftActionResponse(
                7L, "MAKE_PICK", 42L, "DRAFTING", "ACTIVE", "SEC", "Iowa", 3, 43L, false));

    mockMvc
        .perform(
            post("/v1/drafts/7/picks")
                .header("X-User-Id", "42")
                .header("X-Trace-Id", "trace-9")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"team_name\":\"Iowa\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.team_name").value("Iowa"))
        .andExpect(jsonPath("$.pick_number").value(3))
        .andExpect(jsonPath("$.next_user_id").value(43))
        .andExpect(jsonPath("$.stage_changed").value(false));
  }

  @Test
  void conferenceChoiceIsForwarded() throws Exception {
    when(orchestrator.submitAction(
            eq(7L), eq(42L), eq(new DraftAction.ChooseConference("Big Ten")), any()))
        .thenReturn(
            new DraftActionResponse(
                7L, "CHOOSE_CONFERENCE", 42L, "CLAIM", "PENDING", "Big Ten", null, null, null,
                true));

    mockMvc
        .perform(
            post("/v1/drafts/7/conference")
                .header("X-User-Id", "42")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"conference\":\"Big Ten\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.stage").value("CLAIM"))
        .andExpect(jsonPath("$.stage_changed").value(true));
  }

  @Test
  void claimRaceLossIsRetryableConflict() throws Exception {
    when(orchestrator.submitAction(
            eq(7L), eq(42L), eq(new DraftAction.ClaimTeam("Alabama")), any()))
        .thenThrow(
            DraftActionException.teamTaken(
                DraftErrorCode.TEAM_ALREADY_CLAIMED,
                new TeamHolder("Alabama", 7L, 43L, TeamSource.CLAIM, null)));

    mockMvc
        .perform(
            post("/v1/drafts/7/claims")
                .header("X-User-Id", "42")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"team_name\":\"Alabama\"}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("TEAM_ALREADY_CLAIMED"))
        .andExpect(jsonPath("$.retryable").value(true))
        .andExpect(jsonPath("$.details.holder_user_id").value(43))
        .andExpect(
            jsonPath("$.message").value("Alabama was already claimed by user 43 in draft 7"));
  }

  @Test
  void nonParticipantIsForbidden() throws Exception {
    when(orchestrator.submitAction(anyLong(), anyLong(), any(DraftAction.class), any()))
        .thenThrow(
            new DraftActionException(DraftErrorCode.NOT_A_PARTICIPANT, "not a participant"));

    mockMvc
        .perform(
            post("/v1/drafts/7/picks")
                .header("X-User-Id", "99")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"team_name\":\"Iowa\"}"))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.code").value("NOT_A_PARTICIPANT"));
  }

  @Test
  void unavailableTeamIsUnprocessable() throws Exception {
    when(orchestrator.submitAction(anyLong(), anyLong(), any(DraftAction.class), any()))
        .thenThrow(
            new DraftActionException(DraftErrorCode.TEAM_UNAVAILABLE, "unknown team: Yale"));

    mockMvc
        .perform(
            post("/v1/drafts/7/picks")
                .header("X-User-Id", "42")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"team_name\":\"Yale\"}"))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.message").value("unknown team: Yale"));
  }

  @Test
  void invariantViolationHidesInternalMessage() throws Exception {
    when(orchestrator.submitAction(anyLong(), anyLong(), any(DraftAction.class), any()))
        .thenThrow(new IllegalStateException("pick number collided under draft lock draftId=7"));

    mockMvc
        .perform(
            post("/v1/drafts/7/picks")
                .header("X-User-Id", "42")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"team_name\":\"Iowa\"}"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"))
        .andExpect(jsonPath("$.message").value("internal error"));
  }

  @Test
  void blankTeamNameIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/v1/drafts/7/picks")
                .header("X-User-Id", "42")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"team_name\":\"  \"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("team_name is required"));
    verifyNoInteractions(orchestrator);
  }

  @Test
  void missingUserHeaderIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/v1/drafts/7/claims")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"team_name\":\"Iowa\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("X-User-Id is required"));
  }

  @Test
  void malformedBodyIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/v1/drafts/7/claims")
                .header("X-User-Id", "42")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"team_name\":"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("request body is invalid"));
  }

  @Test
  void nonNumericDraftIdIsBadRequest() throws Exception {
    mockMvc
        .perform(get("/v1/drafts/abc"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("draft_id is invalid"));
  }

  @Test
  void unknownDraftIsNotFound() throws Exception {
    when(queryService.getDraft(404L))
        .thenThrow(
            new DraftActionException(
                DraftErrorCode.DRAFT_NOT_FOUND, "draft 404 was not found"));

    mockMvc
        .perform(get("/v1/drafts/404"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("DRAFT_NOT_FOUND"));
  }

  @Test
  void availableTeamsPassesConferenceFilter() throws Exception {
    when(queryService.availableTeams(7L, "sec"))
        .thenReturn(
            new AvailableTeamsResponse(
                7L,
                2,
                List.of(
                    new AvailableTeamsResponse.ConferenceTeams(
                        "SEC", List.of("LSU", "Ole Miss")))));

    mockMvc
        .perform(get("/v1/drafts/7/teams/available").param("conference", "sec"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total_available").value(2))
        .andExpect(jsonPath("$.conferences[0].teams[1]").value("Ole Miss"));
    verify(queryService).availableTeams(7L, "sec");
  }

  @Test
  void unknownConferenceFilterListsAvailableConferences() throws Exception {
    when(queryService.conferenceRosters(7L, "MWC"))
        .thenThrow(
            new DraftActionException(
                DraftErrorCode.UNKNOWN_CONFERENCE,
                "unknown conference: MWC",
                Map.of("available_conferences", List.of("ACC", "SEC"))));

    mockMvc
        .perform(get("/v1/drafts/7/rosters").param("conference", "MWC"))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.details.available_conferences[1]").value("SEC"));
  }
}
