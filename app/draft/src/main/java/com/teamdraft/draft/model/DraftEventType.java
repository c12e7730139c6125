package com.teamdraft.draft.model;

// outbox_events.event_type と NATS ヘッダに載せるイベント名
public enum DraftEventType {
  DRAFT_CREATED("DraftCreated"),
  CONFERENCE_CHOSEN("ConferenceChosen"),
  TEAM_CLAIMED("TeamClaimed"),
  PICK_MADE("PickMade"),
  DRAFT_STAGE_CHANGED("DraftStageChanged"),
  DRAFT_COMPLETED("DraftCompleted"),
  DRAFT_CANCELLED("DraftCancelled");

  private final String eventName;

  DraftEventType(String eventName) {
    this.eventName = eventName;
  }

  public String eventName() {
    return eventName;
  }
}
