package com.aiinpocket.adwatch.controller;

import com.aiinpocket.adwatch.model.dto.RescheduleRequest;
import com.aiinpocket.adwatch.model.dto.WatcherRequest;
import com.aiinpocket.adwatch.model.dto.WatcherResponse;
import com.aiinpocket.adwatch.model.entity.Watcher;
import com.aiinpocket.adwatch.service.WatcherScheduler;
import com.aiinpocket.adwatch.service.WatcherService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 監控器管理 REST API。
 * 錯誤回應統一由 {@link GlobalExceptionHandler} 轉成 {"error": "..."} 格式。
 */
@RestController
@RequestMapping("/api/watchers")
@RequiredArgsConstructor
public class WatcherController {

    private final WatcherService watcherService;
    private final WatcherScheduler watcherScheduler;

    @GetMapping
    public List<WatcherResponse> listWatchers() {
        return watcherService.listWatchers().stream()
                .map(this::toResponse)
                .toList();
    }

    @GetMapping("/{id}")
    public WatcherResponse getWatcher(@PathVariable String id) {
        return toResponse(watcherService.getWatcher(id));
    }

    @PostMapping
    public ResponseEntity<WatcherResponse> createWatcher(@Valid @RequestBody WatcherRequest request) {
        Watcher created = watcherService.createWatcher(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(created));
    }

    @PutMapping("/{id}")
    public WatcherResponse updateWatcher(@PathVariable String id, @Valid @RequestBody WatcherRequest request) {
        return toResponse(watcherService.updateWatcher(id, request));
    }

    /** 暫停：取消排程，保留執行紀錄與去重標記 */
    @PostMapping("/{id}/pause")
    public WatcherResponse pauseWatcher(@PathVariable String id) {
        return toResponse(watcherService.pauseWatcher(id));
    }

    @PostMapping("/{id}/resume")
    public WatcherResponse resumeWatcher(@PathVariable String id) {
        return toResponse(watcherService.resumeWatcher(id));
    }

    @PutMapping("/{id}/schedule")
    public WatcherResponse rescheduleWatcher(@PathVariable String id, @Valid @RequestBody RescheduleRequest request) {
        return toResponse(watcherService.rescheduleWatcher(id, request.schedule()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteWatcher(@PathVariable String id) {
        watcherService.deleteWatcher(id);
        return ResponseEntity.noContent().build();
    }

    private WatcherResponse toResponse(Watcher watcher) {
        return WatcherResponse.from(watcher, watcherScheduler.nextFireTime(watcher.getId()));
    }
}
