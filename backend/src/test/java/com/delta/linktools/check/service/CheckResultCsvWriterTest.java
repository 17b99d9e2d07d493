package com.delta.linktools.check.service;

import com.delta.linktools.check.model.DomainCheckResult;
import com.delta.linktools.check.model.DomainCheckStatus;
import com.delta.linktools.check.model.LinkCheckResult;
import com.delta.linktools.check.model.LinkCheckStatus;
import com.delta.linktools.check.model.TargetMatch;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CheckResultCsvWriterTest {
    private final CheckResultCsvWriter writer = new CheckResultCsvWriter();

    @Test
    void writesLinkResultsWithJoinedAnchors() {
        String csv = writer.writeLinkResults(List.of(
            new LinkCheckResult(1, "https://a.com", "https://t.com/x", "Wrong", LinkCheckStatus.ANCHOR_MISMATCH,
                List.of("One", "Two, three"), null),
            new LinkCheckResult(2, "https://b.com", "https://t.com/y", "", LinkCheckStatus.FETCH_ERROR,
                List.of(), "HTTP 500 for url: https://b.com")
        ));

        List<String> lines = csv.lines().toList();
        assertThat(lines).hasSize(3);
        assertThat(lines.get(0)).isEqualTo("row_num,site,expected_link,expected_anchor,status,found_anchors,error");
        assertThat(lines.get(1)).isEqualTo("1,https://a.com,https://t.com/x,Wrong,anchor_mismatch,\"One | Two, three\",");
        assertThat(lines.get(2)).isEqualTo("2,https://b.com,https://t.com/y,,fetch_error,,HTTP 500 for url: https://b.com");
    }

    @Test
    void writesOneFoundAndAnchorsColumnPairPerTarget() {
        Map<String, TargetMatch> targets = new LinkedHashMap<>();
        targets.put("partner.com", new TargetMatch(true, List.of("Partner", "[no anchor]")));
        targets.put("other.org", TargetMatch.notFound());

        String csv = writer.writeDomainResults(List.of(
            new DomainCheckResult("a.com", DomainCheckStatus.OK, null, 4, targets),
            new DomainCheckResult("b.com", DomainCheckStatus.ERROR, "timeout", 0, Map.of())
        ));

        List<String> lines = csv.lines().toList();
        assertThat(lines.get(0)).isEqualTo("domain,status,links_count,error,partner.com_found,partner.com_anchors,other.org_found,other.org_anchors");
        assertThat(lines.get(1)).isEqualTo("a.com,ok,4,,yes,Partner | [no anchor],no,");
        assertThat(lines.get(2)).isEqualTo("b.com,error,0,timeout,no,,no,");
    }

    @Test
    void emptyResultsStillHaveHeader() {
        assertThat(writer.writeLinkResults(List.of()).lines().toList()).hasSize(1);
        assertThat(writer.writeDomainResults(List.of()).lines().toList()).containsExactly("domain,status,links_count,error");
    }
}
