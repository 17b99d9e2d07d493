package com.delta.linktools.check.api;

import com.delta.linktools.check.model.ExpectedLinkRow;
import com.delta.linktools.check.model.LinkCheckResult;
import com.delta.linktools.check.model.LinkCheckStatusResponse;
import com.delta.linktools.check.model.LinkCheckSubmitResponse;
import com.delta.linktools.check.model.ResultPage;
import com.delta.linktools.check.model.StopResponse;
import com.delta.linktools.check.service.CheckInputParser;
import com.delta.linktools.check.service.CheckResultCsvWriter;
import com.delta.linktools.check.service.LinkCheckService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/link-check")
public class LinkCheckController {
    private final LinkCheckService linkCheckService;
    private final CheckInputParser inputParser;
    private final CheckResultCsvWriter csvWriter;

    public LinkCheckController(
        LinkCheckService linkCheckService,
        CheckInputParser inputParser,
        CheckResultCsvWriter csvWriter
    ) {
        this.linkCheckService = linkCheckService;
        this.inputParser = inputParser;
        this.csvWriter = csvWriter;
    }

    @PostMapping("/start")
    public LinkCheckSubmitResponse start(@RequestBody(required = false) LinkCheckApiRequest request) {
        List<ExpectedLinkRow> rows = inputParser.parseLinkRows(request == null ? null : request.csv());
        return linkCheckService.startAsync(
            rows,
            request == null ? null : request.threads(),
            request == null ? null : request.timeout()
        );
    }

    @GetMapping("/status")
    public LinkCheckStatusResponse status() {
        return linkCheckService.getStatus();
    }

    @GetMapping("/results")
    public ResultPage<LinkCheckResult> results(
        @RequestParam(name = "status", required = false, defaultValue = "all") String status,
        @RequestParam(name = "page", required = false) Integer page,
        @RequestParam(name = "pageSize", required = false) Integer pageSize
    ) {
        return linkCheckService.getResults(status, page, pageSize);
    }

    @GetMapping("/export")
    public ResponseEntity<String> export(
        @RequestParam(name = "status", required = false, defaultValue = "all") String status
    ) {
        String csv = csvWriter.writeLinkResults(linkCheckService.getAllResults(status));
        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"link-check-results.csv\"")
            .contentType(new MediaType("text", "csv"))
            .body(csv);
    }

    @PostMapping("/stop")
    public StopResponse stop() {
        return linkCheckService.stop();
    }
}
