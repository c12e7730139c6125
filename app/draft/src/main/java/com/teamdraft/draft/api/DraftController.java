/*
 * どこで: Draft API
 * 何を: 参加者の conference 選択/claim/pick と参照系エンドポイントを提供する
 * なぜ: チャット連携側がスラッシュコマンドをそのまま HTTP 呼び出しへ写せるようにするため
 */
package com.teamdraft.draft.api;

import com.teamdraft.draft.api.request.ChooseConferenceRequest;
import com.teamdraft.draft.api.request.TeamRequest;
import com.teamdraft.draft.api.response.AvailableTeamsResponse;
import com.teamdraft.draft.api.response.ConferenceRostersResponse;
import com.teamdraft.draft.api.response.ConferenceSlotsResponse;
import com.teamdraft.draft.api.response.DraftActionResponse;
import com.teamdraft.draft.api.response.DraftResponse;
import com.teamdraft.draft.model.DraftAction;
import com.teamdraft.draft.service.DraftOrchestrator;
import com.teamdraft.draft.service.DraftQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Validated
public class DraftController {

  static final String HEADER_USER_ID = "X-User-Id";
  static final String HEADER_TRACE_ID = "X-Trace-Id";

  private final DraftOrchestrator orchestrator;
  private final DraftQueryService queryService;

  @PostMapping("/drafts/{draft_id}/conference")
  public DraftActionResponse chooseConference(
      @PathVariable("draft_id") long draftId,
      @RequestHeader(HEADER_USER_ID) long userId,
      @RequestHeader(value = HEADER_TRACE_ID, required = false) String traceId,
      @Valid @RequestBody ChooseConferenceRequest request) {
    return orchestrator.submitAction(
        draftId, userId, new DraftAction.ChooseConference(request.conference()), traceId);
  }

  @PostMapping("/drafts/{draft_id}/claims")
  public DraftActionResponse claimTeam(
      @PathVariable("draft_id") long draftId,
      @RequestHeader(HEADER_USER_ID) long userId,
      @RequestHeader(value = HEADER_TRACE_ID, required = false) String traceId,
      @Valid @RequestBody TeamRequest request) {
    return orchestrator.submitAction(
        draftId, userId, new DraftAction.ClaimTeam(request.teamName()), traceId);
  }

  @PostMapping("/drafts/{draft_id}/picks")
  public DraftActionResponse makePick(
      @PathVariable("draft_id") long draftId,
      @RequestHeader(HEADER_USER_ID) long userId,
      @RequestHeader(value = HEADER_TRACE_ID, required = false) String traceId,
      @Valid @RequestBody TeamRequest request) {
    return orchestrator.submitAction(
        draftId, userId, new DraftAction.MakePick(request.teamName()), traceId);
  }

  @GetMapping("/drafts/{draft_id}")
  public DraftResponse getDraft(@PathVariable("draft_id") long draftId) {
    return queryService.getDraft(draftId);
  }

  @GetMapping("/guilds/{guild_id}/drafts/current")
  public DraftResponse currentDraft(@PathVariable("guild_id") long guildId) {
    return queryService.currentDraft(guildId);
  }

  @GetMapping("/drafts/{draft_id}/teams/available")
  public AvailableTeamsResponse availableTeams(
      @PathVariable("draft_id") long draftId,
      @RequestParam(value = "conference", required = false) String conference) {
    return queryService.availableTeams(draftId, conference);
  }

  @GetMapping("/drafts/{draft_id}/conferences")
  public ConferenceSlotsResponse conferenceSlots(@PathVariable("draft_id") long draftId) {
    return queryService.conferenceSlots(draftId);
  }

  @GetMapping("/drafts/{draft_id}/rosters")
  public ConferenceRostersResponse conferenceRosters(
      @PathVariable("draft_id") long draftId,
      @RequestParam(value = "conference", required = false) String conference) {
    return queryService.conferenceRosters(draftId, conference);
  }
}
