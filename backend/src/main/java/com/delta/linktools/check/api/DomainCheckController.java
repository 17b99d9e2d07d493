package com.delta.linktools.check.api;

import com.delta.linktools.check.model.DomainCheckResult;
import com.delta.linktools.check.model.DomainCheckStatusResponse;
import com.delta.linktools.check.model.DomainCheckSubmitResponse;
import com.delta.linktools.check.model.ResultPage;
import com.delta.linktools.check.model.StopResponse;
import com.delta.linktools.check.service.CheckInputParser;
import com.delta.linktools.check.service.CheckResultCsvWriter;
import com.delta.linktools.check.service.DomainCheckService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/domain-check")
public class DomainCheckController {
    private final DomainCheckService domainCheckService;
    private final CheckInputParser inputParser;
    private final CheckResultCsvWriter csvWriter;

    public DomainCheckController(
        DomainCheckService domainCheckService,
        CheckInputParser inputParser,
        CheckResultCsvWriter csvWriter
    ) {
        this.domainCheckService = domainCheckService;
        this.inputParser = inputParser;
        this.csvWriter = csvWriter;
    }

    @PostMapping("/start")
    public DomainCheckSubmitResponse start(@RequestBody(required = false) DomainCheckApiRequest request) {
        return domainCheckService.startAsync(
            inputParser.parseDomainList(request == null ? null : request.domains()),
            inputParser.parseDomainList(request == null ? null : request.targets()),
            request == null ? null : request.threads(),
            request == null ? null : request.timeout()
        );
    }

    @GetMapping("/status")
    public DomainCheckStatusResponse status() {
        return domainCheckService.getStatus();
    }

    @GetMapping("/results")
    public ResultPage<DomainCheckResult> results(
        @RequestParam(name = "status", required = false, defaultValue = "all") String status,
        @RequestParam(name = "page", required = false) Integer page,
        @RequestParam(name = "pageSize", required = false) Integer pageSize
    ) {
        return domainCheckService.getResults(status, page, pageSize);
    }

    @GetMapping("/export")
    public ResponseEntity<String> export(
        @RequestParam(name = "status", required = false, defaultValue = "all") String status
    ) {
        String csv = csvWriter.writeDomainResults(domainCheckService.getAllResults(status));
        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"domain-check-results.csv\"")
            .contentType(new MediaType("text", "csv"))
            .body(csv);
    }

    @PostMapping("/stop")
    public StopResponse stop() {
        return domainCheckService.stop();
    }
}
