package com.delta.scraper.scrape.api;

import com.delta.scraper.scrape.job.InMemoryResultSink;
import com.delta.scraper.scrape.job.InMemoryTemplateSource;
import com.delta.scraper.scrape.job.JobOrchestrator;
import com.delta.scraper.scrape.job.UnknownJobException;
import com.delta.scraper.scrape.model.JobProgress;
import com.delta.scraper.scrape.model.JobRequest;
import com.delta.scraper.scrape.model.JobStatus;
import com.delta.scraper.scrape.model.JobView;
import com.delta.scraper.scrape.model.PageResult;
import com.delta.scraper.scrape.model.Template;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class ScrapeController {
    private final JobOrchestrator orchestrator;
    private final InMemoryTemplateSource templateSource;
    private final InMemoryResultSink resultSink;

    public ScrapeController(
        JobOrchestrator orchestrator,
        InMemoryTemplateSource templateSource,
        InMemoryResultSink resultSink
    ) {
        this.orchestrator = orchestrator;
        this.templateSource = templateSource;
        this.resultSink = resultSink;
    }

    @PostMapping("/templates")
    @ResponseStatus(HttpStatus.CREATED)
    public Template registerTemplate(@RequestBody Template template) {
        return templateSource.register(template);
    }

    @GetMapping("/templates")
    public List<Template> listTemplates() {
        return templateSource.list();
    }

    @PostMapping("/jobs")
    @ResponseStatus(HttpStatus.CREATED)
    public JobView submitJob(@RequestBody JobApiRequest request) {
        if (request == null) {
            throw new ResponseStatusException(BAD_REQUEST, "request body is required");
        }
        JobRequest jobRequest = new JobRequest(request.name(), request.template(), request.targetUrl(), request.parameters());
        if (Boolean.TRUE.equals(request.start())) {
            return orchestrator.submitAndStart(jobRequest);
        }
        return orchestrator.submit(jobRequest);
    }

    @GetMapping("/jobs")
    public List<JobView> listJobs(@RequestParam(name = "status", required = false) String status) {
        return orchestrator.listJobs(parseStatus(status));
    }

    @GetMapping("/jobs/{id}")
    public JobView getJob(@PathVariable("id") String jobId) {
        return orchestrator.getJob(jobId);
    }

    @GetMapping("/jobs/{id}/progress")
    public JobProgress getProgress(@PathVariable("id") String jobId) {
        return orchestrator.getProgress(jobId);
    }

    @GetMapping("/jobs/{id}/results")
    public List<PageResult> getResults(@PathVariable("id") String jobId) {
        try {
            return orchestrator.getResults(jobId);
        } catch (UnknownJobException e) {
            return resultSink.find(jobId).orElseThrow(() -> e);
        }
    }

    @PostMapping("/jobs/{id}/start")
    public JobView start(@PathVariable("id") String jobId) {
        return orchestrator.start(jobId);
    }

    @PostMapping("/jobs/{id}/cancel")
    public JobView cancel(@PathVariable("id") String jobId) {
        return orchestrator.cancel(jobId);
    }

    @PostMapping("/jobs/{id}/pause")
    public JobView pause(@PathVariable("id") String jobId) {
        return orchestrator.pause(jobId);
    }

    @PostMapping("/jobs/{id}/resume")
    public JobView resume(@PathVariable("id") String jobId) {
        return orchestrator.resume(jobId);
    }

    @DeleteMapping("/jobs/{id}")
    public Map<String, Object> purge(@PathVariable("id") String jobId) {
        return Map.of("id", jobId, "purged", orchestrator.purge(jobId));
    }

    private JobStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return JobStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(BAD_REQUEST, "Unsupported status value: " + status);
        }
    }
}
