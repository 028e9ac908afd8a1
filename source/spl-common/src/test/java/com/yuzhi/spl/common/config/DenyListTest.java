package com.yuzhi.spl.common.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class DenyListTest {

    @Test
    void defaultsMatchWholeCommandsCaseInsensitively() {
        DenyList denyList = DenyList.defaults();

        assertThat(denyList.firstMatch("index=main | OUTPUTLOOKUP hosts.csv")).contains("OUTPUTLOOKUP");
        assertThat(denyList.firstMatch("| rest /services/apps/local")).contains("rest");
        assertThat(denyList.firstMatch("search * | map [search index=x]")).isPresent();
        assertThat(denyList.firstMatch("search restart_count>0 | stats count by deleted_flag")).isEmpty();
        assertThat(denyList.firstMatch("search * | map search=foo")).isEmpty();
    }

    @Test
    void parseSkipsBlankLinesAndTrims() {
        DenyList denyList = DenyList.parse("  tscollect \n\n\r\ndbxquery\r\n");

        assertThat(denyList.fragments()).containsExactly("tscollect", "dbxquery");
        assertThat(denyList.firstMatch("| dbxquery query=\"select 1\"")).contains("dbxquery");
        assertThat(denyList.firstMatch("| delete")).isEmpty();
    }

    @Test
    void blankTextYieldsEmptyList() {
        assertThat(DenyList.parse("  \n ").isEmpty()).isTrue();
        assertThat(DenyList.parse(null).firstMatch("| delete")).isEmpty();
        assertThat(DenyList.of(List.of()).isEmpty()).isTrue();
    }

    @Test
    void malformedFragmentIsRejectedWithItsLine() {
        assertThatThrownBy(() -> DenyList.parse("delete\nmap\\s+[\n"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("line 2")
            .hasMessageContaining("map\\s+[");
    }
}
