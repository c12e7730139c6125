/*
 * どこで: Draft ドメインモデル
 * 何を: 利用者アクションを閉じた型の集合として表す
 * なぜ: オーケストレータが stage ごとに網羅的に振り分けられるようにするため
 */
package com.teamdraft.draft.model;

public sealed interface DraftAction
    permits DraftAction.ChooseConference, DraftAction.ClaimTeam, DraftAction.MakePick {

  Kind kind();

  enum Kind {
    CHOOSE_CONFERENCE(DraftStage.CONFERENCE),
    CLAIM_TEAM(DraftStage.CLAIM),
    MAKE_PICK(DraftStage.DRAFTING);

    private final DraftStage requiredStage;

    Kind(DraftStage requiredStage) {
      this.requiredStage = requiredStage;
    }

    public DraftStage requiredStage() {
      return requiredStage;
    }
  }

  record ChooseConference(String conference) implements DraftAction {
    @Override
    public Kind kind() {
      return Kind.CHOOSE_CONFERENCE;
    }
  }

  record ClaimTeam(String teamName) implements DraftAction {
    @Override
    public Kind kind() {
      return Kind.CLAIM_TEAM;
    }
  }

  record MakePick(String teamName) implements DraftAction {
    @Override
    public Kind kind() {
      return Kind.MAKE_PICK;
    }
  }
}
