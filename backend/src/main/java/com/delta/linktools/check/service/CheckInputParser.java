package com.delta.linktools.check.service;

import com.delta.linktools.check.model.ExpectedLinkRow;
import com.delta.linktools.check.util.UrlNormalizer;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns submitted text into check input: {@code site,link[,anchor]} CSV for link checks and
 * newline/comma separated host lists for domain checks.
 */
@Component
public class CheckInputParser {

    /**
     * Rows keep their 1-based record number. Records with fewer than two columns or a blank site or
     * link are dropped, and a site without a scheme gets {@code https://}.
     */
    public List<ExpectedLinkRow> parseLinkRows(String rawCsv) {
        if (rawCsv == null || rawCsv.isBlank()) {
            return List.of();
        }
        List<ExpectedLinkRow> rows = new ArrayList<>();
        try (CSVParser parser = csvFormat().parse(new StringReader(rawCsv.strip()))) {
            for (CSVRecord record : parser) {
                if (record.size() < 2) {
                    continue;
                }
                String site = record.get(0).trim();
                String link = record.get(1).trim();
                String anchor = record.size() > 2 ? record.get(2).trim() : "";
                if (site.isEmpty() || link.isEmpty()) {
                    continue;
                }
                if (record.getRecordNumber() == 1 && isHeader(site, link)) {
                    continue;
                }
                if (!UrlNormalizer.isHttpLike(site)) {
                    site = "https://" + site;
                }
                rows.add(new ExpectedLinkRow((int) record.getRecordNumber(), site, link, anchor));
            }
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            throw new InvalidCheckRequestException("invalid_csv", "Could not parse CSV: " + e.getMessage());
        }
        return rows;
    }

    /**
     * Splits on newlines and commas and cleans each entry to a bare host, dropping blanks.
     */
    public List<String> parseDomainList(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        List<String> hosts = new ArrayList<>();
        for (String line : raw.replace(',', '\n').split("\n")) {
            String host = UrlNormalizer.toBareHost(line);
            if (!host.isEmpty()) {
                hosts.add(host);
            }
        }
        return hosts;
    }

    private static boolean isHeader(String site, String link) {
        return "site".equalsIgnoreCase(site) && "link".equalsIgnoreCase(link);
    }

    private static CSVFormat csvFormat() {
        return CSVFormat.DEFAULT.builder()
            .setIgnoreEmptyLines(false)
            .setIgnoreSurroundingSpaces(true)
            .build();
    }
}
