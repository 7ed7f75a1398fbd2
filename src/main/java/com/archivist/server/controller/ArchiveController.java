package com.archivist.server.controller;

import com.archivist.server.model.api.archive.ArchiveRequest;
import com.archivist.server.model.api.archive.ExtractArchiveRequest;
import com.archivist.server.model.api.archive.PruneArchivesRequest;
import com.archivist.server.model.api.global.ArchivistHttpResponse;
import com.archivist.server.model.borgmatic.BorgArchive;
import com.archivist.server.model.exec.CommandResult;
import com.archivist.server.service.borgmatic.BorgmaticParser;
import com.archivist.server.service.borgmatic.BorgmaticService;
import com.archivist.server.util.CommandResultUtil;
import com.archivist.server.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/archives")
@Slf4j
@CrossOrigin(originPatterns = "*")
public class ArchiveController {

    private final BorgmaticService borgmaticService;

    @Autowired
    public ArchiveController(BorgmaticService borgmaticService) {
        this.borgmaticService = borgmaticService;
    }

    @GetMapping("/list-archives")
    public ArchivistHttpResponse<List<BorgArchive>> listArchives(@RequestParam("repository") String repository) {
        CommandResult listResult = CommandResultUtil.requireSuccess(
                this.borgmaticService.listArchives(repository), "listArchives");
        return ArchivistHttpResponse.success(BorgmaticParser.flattenArchives(
                BorgmaticParser.parseListings(listResult.getStdout())));
    }

    @GetMapping("/get-archive-info")
    public ArchivistHttpResponse<JsonNode> getArchiveInfo(
            @RequestParam("repository") String repository,
            @RequestParam("archive") String archive) {
        CommandResult infoResult = CommandResultUtil.requireSuccess(
                this.borgmaticService.getArchiveInfo(repository, archive), "getArchiveInfo");
        return ArchivistHttpResponse.success(JsonUtil.parseJsonTree(infoResult.getStdout()));
    }

    @GetMapping("/get-archive-contents")
    public ArchivistHttpResponse<JsonNode> getArchiveContents(
            @RequestParam("repository") String repository,
            @RequestParam("archive") String archive,
            @RequestParam(value = "path", required = false) String path) {
        CommandResult contentsResult = CommandResultUtil.requireSuccess(
                this.borgmaticService.listArchiveContents(repository, archive, path), "getArchiveContents");
        return ArchivistHttpResponse.success(JsonUtil.parseJsonTree(contentsResult.getStdout()));
    }

    @PostMapping("/extract-archive")
    public ArchivistHttpResponse<CommandResult> extractArchive(
            @RequestBody ExtractArchiveRequest extractArchiveRequest) {
        CommandResult extractResult = this.borgmaticService.extractArchive(
                extractArchiveRequest.getRepository(),
                extractArchiveRequest.getArchive(),
                extractArchiveRequest.getPaths(),
                extractArchiveRequest.getDestination(),
                extractArchiveRequest.isDryRun());
        return ArchivistHttpResponse.success(CommandResultUtil.requireSuccess(extractResult, "extractArchive"),
                extractArchiveRequest.isDryRun() ? "Dry run completed" : "Archive extracted");
    }

    @PostMapping("/delete-archive")
    public ArchivistHttpResponse<CommandResult> deleteArchive(@RequestBody ArchiveRequest archiveRequest) {
        CommandResult deleteResult = this.borgmaticService.deleteArchive(
                archiveRequest.getRepository(), archiveRequest.getArchive());
        return ArchivistHttpResponse.success(CommandResultUtil.requireSuccess(deleteResult, "deleteArchive"),
                "Archive deleted");
    }

    @PostMapping("/prune-archives")
    public ArchivistHttpResponse<CommandResult> pruneArchives(
            @RequestBody PruneArchivesRequest pruneArchivesRequest) {
        CommandResult pruneResult = this.borgmaticService.pruneArchives(
                pruneArchivesRequest.getRepository(), pruneArchivesRequest.getRetention());
        return ArchivistHttpResponse.success(CommandResultUtil.requireSuccess(pruneResult, "pruneArchives"),
                "Archives pruned");
    }
}
