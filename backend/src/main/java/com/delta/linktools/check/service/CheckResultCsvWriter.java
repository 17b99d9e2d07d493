package com.delta.linktools.check.service;

import com.delta.linktools.check.model.DomainCheckResult;
import com.delta.linktools.check.model.LinkCheckResult;
import com.delta.linktools.check.model.TargetMatch;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * CSV export of published check results.
 */
@Component
public class CheckResultCsvWriter {
    private static final String ANCHOR_SEPARATOR = " | ";

    public String writeLinkResults(List<LinkCheckResult> results) {
        StringWriter out = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(out, CSVFormat.DEFAULT)) {
            printer.printRecord("row_num", "site", "expected_link", "expected_anchor", "status", "found_anchors", "error");
            for (LinkCheckResult result : results) {
                printer.printRecord(
                    result.rowNum(),
                    result.site(),
                    result.expectedLink(),
                    result.expectedAnchor(),
                    result.status().wireName(),
                    String.join(ANCHOR_SEPARATOR, result.foundAnchors()),
                    result.error() == null ? "" : result.error()
                );
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    public String writeDomainResults(List<DomainCheckResult> results) {
        Set<String> targets = new LinkedHashSet<>();
        for (DomainCheckResult result : results) {
            targets.addAll(result.targets().keySet());
        }

        List<String> header = new ArrayList<>(List.of("domain", "status", "links_count", "error"));
        for (String target : targets) {
            header.add(target + "_found");
            header.add(target + "_anchors");
        }

        StringWriter out = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(out, CSVFormat.DEFAULT)) {
            printer.printRecord(header);
            for (DomainCheckResult result : results) {
                List<Object> row = new ArrayList<>();
                row.add(result.domain());
                row.add(result.status().wireName());
                row.add(result.linksCount());
                row.add(result.error() == null ? "" : result.error());
                for (String target : targets) {
                    TargetMatch match = result.targets().getOrDefault(target, TargetMatch.notFound());
                    row.add(match.found() ? "yes" : "no");
                    row.add(String.join(ANCHOR_SEPARATOR, match.anchors()));
                }
                printer.printRecord(row);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }
}
