package com.github.stormino.transcoder.controller;

import com.github.stormino.transcoder.exception.JobNotFoundException;
import com.github.stormino.transcoder.model.DownloadJob;
import com.github.stormino.transcoder.service.DownloadOrchestrator;
import com.github.stormino.transcoder.service.RangeContentServer;
import com.github.stormino.transcoder.util.DownloadConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

@Slf4j
@RestController
@RequiredArgsConstructor
public class ResultController {

    private final DownloadOrchestrator orchestrator;
    private final RangeContentServer contentServer;

    /**
     * Page with the player and download link of a finished conversion
     */
    @GetMapping("/result/{id}")
    public ResponseEntity<String> resultPage(@PathVariable String id) {
        DownloadJob job = orchestrator.findJob(id)
                .filter(DownloadJob::isDone)
                .orElseThrow(() -> new JobNotFoundException(id));

        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_HTML)
                .body(renderPage(job));
    }

    /**
     * Video of a finished conversion, with byte-range support
     */
    @GetMapping("/result/video/{id}")
    public ResponseEntity<StreamingResponseBody> video(
            @PathVariable String id,
            @RequestHeader(value = HttpHeaders.RANGE, required = false) String range) {
        return contentServer.serve(orchestrator.requireCompleted(id), range);
    }

    static String renderPage(DownloadJob job) {
        String title = job.getFingerprint().getDisplayName();
        String videoUrl = DownloadConstants.RESULT_VIDEO_PATH + job.getId();

        Document page = Document.createShell("");
        page.title(title);
        page.head().appendElement("meta").attr("charset", "utf-8");
        page.head().appendElement("meta")
                .attr("name", "viewport")
                .attr("content", "width=device-width, initial-scale=1");

        Element body = page.body();
        body.appendElement("h1").text(title);

        Element video = body.appendElement("video")
                .attr("controls", true)
                .attr("preload", "metadata")
                .attr("width", "100%");
        if (job.getImageUrl() != null) {
            video.attr("poster", job.getImageUrl());
        }
        video.appendElement("source")
                .attr("src", videoUrl)
                .attr("type", DownloadConstants.VIDEO_CONTENT_TYPE);

        body.appendElement("p").appendElement("a")
                .attr("href", videoUrl)
                .attr("download", job.getId() + DownloadConstants.VIDEO_EXTENSION)
                .text("Download");

        return page.outerHtml();
    }
}
