package com.dubbi.statetrace.trace.parser;

import static com.dubbi.statetrace.trace.TraceFixtures.HOME;
import static com.dubbi.statetrace.trace.TraceFixtures.LOGIN;
import static com.dubbi.statetrace.trace.TraceFixtures.PROFILE;
import static org.assertj.core.api.Assertions.assertThat;

import com.dubbi.statetrace.trace.TraceFixtures;
import com.dubbi.statetrace.trace.domain.IdMap;
import com.dubbi.statetrace.trace.domain.ScreenListing;
import org.junit.jupiter.api.Test;

class ScreenBlockReassemblerTest {

    @Test
    void replacesLeadingHashAndKeepsContinuationLines() {
        ScreenListing listing = ScreenBlockReassembler.reassemble(TraceDocument.of(TraceFixtures.loginHomeTrace()));

        assertThat(listing.blocks()).containsExactly(
                "S1, Login, activity=MainActivity\n  Shows the login form, with two fields",
                "S2, Home, activity=HomeActivity"
        );
        assertThat(listing.screenIds().canonicalToOriginal())
                .containsEntry("S1", LOGIN)
                .containsEntry("S2", HOME);
        assertThat(listing.warnings()).isEmpty();
    }

    @Test
    void repeatedHashBlocksAreKeptAndSortedByScreenNumber() {
        String trace = "States (3):\n"
                + LOGIN + ", Login, x\n"
                + HOME + ", Home, y\n"
                + LOGIN + ", Login again, z\n";

        ScreenListing listing = ScreenBlockReassembler.reassemble(TraceDocument.of(trace));

        assertThat(listing.blocks()).containsExactly(
                "S1, Login, x",
                "S1, Login again, z",
                "S2, Home, y"
        );
    }

    @Test
    void blockWithUnmappedHashIsSkippedWithWarning() {
        IdMap.Builder ids = IdMap.builder(IdMap.SCREEN_PREFIX);
        ids.assign(HOME);
        String trace = "States (2):\n"
                + LOGIN + ", Login, x\n"
                + HOME + ", Home, y\n";

        ScreenListing listing = ScreenBlockReassembler.reassemble(TraceDocument.of(trace), ids.build());

        assertThat(listing.blocks()).containsExactly("S1, Home, y");
        assertThat(listing.warnings()).singleElement().asString().contains(LOGIN);
    }

    @Test
    void malformedHeaderBlockIsDroppedWhenScreenIsNeverReferenced() {
        String trace = "States (2):\n"
                + PROFILE + ", NoTrailingComma\n"
                + LOGIN + ", Login, x\n";

        ScreenListing listing = ScreenBlockReassembler.reassemble(TraceDocument.of(trace));

        assertThat(listing.blocks()).containsExactly("S1, Login, x");
        // 헤더 경고 + 매핑 누락 경고
        assertThat(listing.warnings()).hasSize(2);
    }

    @Test
    void statesSectionWithoutDefinitionsWarns() {
        ScreenListing listing = ScreenBlockReassembler.reassemble(TraceDocument.of("States (0):\nnothing here\n"));

        assertThat(listing.blocks()).isEmpty();
        assertThat(listing.warnings()).containsExactly("No valid screen definitions found in States section");
    }

    @Test
    void missingStatesSectionIsNotAnError() {
        ScreenListing listing = ScreenBlockReassembler.reassemble(TraceDocument.of("Transitions (0):\n"));

        assertThat(listing.blocks()).isEmpty();
        assertThat(listing.warnings()).isEmpty();
    }

    @Test
    void unparseableIdsSortLast() {
        assertThat(ScreenBlockReassembler.sortKey("S12, x")).isEqualTo(12L);
        assertThat(ScreenBlockReassembler.sortKey("S3:")).isEqualTo(3L);
        assertThat(ScreenBlockReassembler.sortKey("S1X, x")).isEqualTo(Long.MAX_VALUE);
        assertThat(ScreenBlockReassembler.sortKey(LOGIN + ", x")).isEqualTo(Long.MAX_VALUE);
    }
}
