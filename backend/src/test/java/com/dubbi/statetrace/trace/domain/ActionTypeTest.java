package com.dubbi.statetrace.trace.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ActionTypeTest {

    @Test
    void classifiesCommonActionSpellings() {
        assertThat(ActionType.fromAction("click")).isEqualTo(ActionType.CLICK);
        assertThat(ActionType.fromAction("Long Click")).isEqualTo(ActionType.LONG_CLICK);
        assertThat(ActionType.fromAction("long-click")).isEqualTo(ActionType.LONG_CLICK);
        assertThat(ActionType.fromAction("set_text")).isEqualTo(ActionType.INPUT);
        assertThat(ActionType.fromAction("scroll down")).isEqualTo(ActionType.SCROLL);
        assertThat(ActionType.fromAction("swipe_left")).isEqualTo(ActionType.SWIPE);
        assertThat(ActionType.fromAction("back")).isEqualTo(ActionType.BACK);
        assertThat(ActionType.fromAction("launch_app")).isEqualTo(ActionType.NAVIGATE);
    }

    @Test
    void unknownOrMissingActionIsOther() {
        assertThat(ActionType.fromAction(null)).isEqualTo(ActionType.OTHER);
        assertThat(ActionType.fromAction("  ")).isEqualTo(ActionType.OTHER);
        assertThat(ActionType.fromAction("wiggle")).isEqualTo(ActionType.OTHER);
    }
}
