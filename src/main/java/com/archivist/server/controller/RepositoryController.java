package com.archivist.server.controller;

import com.archivist.server.model.api.global.ArchivistHttpResponse;
import com.archivist.server.model.api.repository.RepositoryRequest;
import com.archivist.server.model.borgmatic.RepositoryStatus;
import com.archivist.server.model.exec.CommandResult;
import com.archivist.server.service.borgmatic.BorgmaticService;
import com.archivist.server.util.CommandResultUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/repositories")
@Slf4j
@CrossOrigin(originPatterns = "*")
public class RepositoryController {

    private final BorgmaticService borgmaticService;

    @Autowired
    public RepositoryController(BorgmaticService borgmaticService) {
        this.borgmaticService = borgmaticService;
    }

    // 单个 repository 失败不影响其他, 整体仍然成功
    @GetMapping("/get-repository-status")
    public ArchivistHttpResponse<List<RepositoryStatus>> getRepositoryStatus() {
        return ArchivistHttpResponse.success(this.borgmaticService.getRepositoryStatus());
    }

    @PostMapping("/check-repository")
    public ArchivistHttpResponse<CommandResult> checkRepository(@RequestBody RepositoryRequest repositoryRequest) {
        CommandResult checkResult = this.borgmaticService.checkRepository(repositoryRequest.getRepository());
        return ArchivistHttpResponse.success(CommandResultUtil.requireSuccess(checkResult, "checkRepository"),
                "Repository check completed");
    }

    @PostMapping("/compact-repository")
    public ArchivistHttpResponse<CommandResult> compactRepository(@RequestBody RepositoryRequest repositoryRequest) {
        CommandResult compactResult = this.borgmaticService.compactRepository(repositoryRequest.getRepository());
        return ArchivistHttpResponse.success(CommandResultUtil.requireSuccess(compactResult, "compactRepository"),
                "Repository compacted");
    }
}
