package com.aiinpocket.adwatch.service;

import com.aiinpocket.adwatch.exception.WatcherNotFoundException;
import com.aiinpocket.adwatch.exception.WatcherValidationException;
import com.aiinpocket.adwatch.model.dto.NotificationTargetDto;
import com.aiinpocket.adwatch.model.dto.WatcherRequest;
import com.aiinpocket.adwatch.model.entity.NotificationTarget;
import com.aiinpocket.adwatch.model.entity.Watcher;
import com.aiinpocket.adwatch.model.enums.WatcherStatus;
import com.aiinpocket.adwatch.repository.WatcherRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 監控器管理服務。
 * 建立、修改、暫停、恢復、改排程與刪除監控器，每次變更後同步 {@link WatcherScheduler} 的註冊狀態。
 *
 * <p>所有寫入都在 {@link WatcherLockService} 的監控器鎖內完成「讀取 → 修改 → 儲存 → 同步排程」，
 * 與執行週期寫回結果使用同一把鎖。方法本身不開交易，讓儲存在釋放鎖之前就已提交。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WatcherService {

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private final WatcherRepository watcherRepo;
    private final WatcherScheduler watcherScheduler;
    private final WatcherLockService lockService;

    public List<Watcher> listWatchers() {
        return watcherRepo.findAllByOrderByCreatedAtAsc();
    }

    public Watcher getWatcher(String watcherId) {
        return watcherRepo.findById(watcherId)
                .orElseThrow(() -> new WatcherNotFoundException(watcherId));
    }

    public Watcher createWatcher(WatcherRequest request) {
        List<NotificationTarget> targets = validate(request);
        String watcherId = UUID.randomUUID().toString();

        return lockService.withLock(watcherId, () -> {
            Watcher watcher = Watcher.builder()
                    .id(watcherId)
                    .query(request.query().trim())
                    .schedule(request.schedule().trim())
                    .notifications(targets)
                    .status(WatcherStatus.ACTIVE)
                    .minPrice(request.minPrice())
                    .maxPrice(request.maxPrice())
                    .build();
            Watcher saved = watcherRepo.save(watcher);
            watcherScheduler.register(saved);
            log.info("[監控器] 已建立 {}: '{}' ({})", watcherId, saved.getQuery(), saved.getSchedule());
            return saved;
        });
    }

    /**
     * 修改查詢條件、排程與通知目標。
     * 查詢字串或價格區間變更時清除去重標記，下一次執行重新建立基準。
     */
    public Watcher updateWatcher(String watcherId, WatcherRequest request) {
        List<NotificationTarget> targets = validate(request);

        return lockService.withLock(watcherId, () -> {
            Watcher watcher = getWatcher(watcherId);
            String query = request.query().trim();
            boolean criteriaChanged = !query.equals(watcher.getQuery())
                    || !samePrice(watcher.getMinPrice(), request.minPrice())
                    || !samePrice(watcher.getMaxPrice(), request.maxPrice());

            watcher.setQuery(query);
            watcher.setSchedule(request.schedule().trim());
            watcher.setNotifications(targets);
            watcher.setMinPrice(request.minPrice());
            watcher.setMaxPrice(request.maxPrice());
            if (criteriaChanged) {
                watcher.setSeenAdIds(null);
            }

            Watcher saved = watcherRepo.save(watcher);
            reconcile(saved);
            log.info("[監控器] 已更新 {}: '{}' ({}){}", watcherId, saved.getQuery(), saved.getSchedule(),
                    criteriaChanged ? "，查詢條件變更，重設去重基準" : "");
            return saved;
        });
    }

    public Watcher pauseWatcher(String watcherId) {
        return lockService.withLock(watcherId, () -> {
            Watcher watcher = getWatcher(watcherId);
            watcher.setStatus(WatcherStatus.STOPPED);
            Watcher saved = watcherRepo.save(watcher);
            watcherScheduler.unregister(watcherId);
            log.info("[監控器] 已暫停 {}", watcherId);
            return saved;
        });
    }

    public Watcher resumeWatcher(String watcherId) {
        return lockService.withLock(watcherId, () -> {
            Watcher watcher = getWatcher(watcherId);
            CronScheduleParser.validate(watcher.getSchedule());
            watcher.setStatus(WatcherStatus.ACTIVE);
            Watcher saved = watcherRepo.save(watcher);
            watcherScheduler.register(saved);
            log.info("[監控器] 已恢復 {}", watcherId);
            return saved;
        });
    }

    /** 停止中的監控器只儲存新排程，恢復時才會註冊 */
    public Watcher rescheduleWatcher(String watcherId, String schedule) {
        CronScheduleParser.validate(schedule);

        return lockService.withLock(watcherId, () -> {
            Watcher watcher = getWatcher(watcherId);
            watcher.setSchedule(schedule.trim());
            Watcher saved = watcherRepo.save(watcher);
            reconcile(saved);
            log.info("[監控器] {} 排程改為 '{}'", watcherId, saved.getSchedule());
            return saved;
        });
    }

    public void deleteWatcher(String watcherId) {
        lockService.withLock(watcherId, () -> {
            if (!watcherRepo.existsById(watcherId)) {
                throw new WatcherNotFoundException(watcherId);
            }
            watcherScheduler.unregister(watcherId);
            watcherRepo.deleteById(watcherId);
            log.info("[監控器] 已刪除 {}", watcherId);
        });
    }

    private void reconcile(Watcher watcher) {
        if (watcher.isActive()) {
            watcherScheduler.register(watcher);
        } else {
            watcherScheduler.unregister(watcher.getId());
        }
    }

    /**
     * 驗證請求內容並轉成通知目標清單。
     * 排程錯誤拋出 InvalidScheduleException，其餘拋出 WatcherValidationException。
     */
    List<NotificationTarget> validate(WatcherRequest request) {
        if (request.query() == null || request.query().isBlank()) {
            throw new WatcherValidationException("查詢字串不能為空");
        }
        CronScheduleParser.validate(request.schedule());
        ListingQueryService.validatePriceRange(request.minPrice(), request.maxPrice());

        List<NotificationTarget> targets = new ArrayList<>();
        if (request.notifications() != null) {
            for (NotificationTargetDto dto : request.notifications()) {
                targets.add(validateTarget(dto));
            }
        }
        return targets;
    }

    private static NotificationTarget validateTarget(NotificationTargetDto dto) {
        if (dto == null || dto.kind() == null) {
            throw new WatcherValidationException("通知目標缺少 kind");
        }
        return switch (dto.kind()) {
            case DISCORD -> {
                if (dto.webhookUrl() == null || dto.webhookUrl().isBlank()) {
                    throw new WatcherValidationException("Discord 通知目標需要 webhook_url");
                }
                yield NotificationTarget.discord(dto.webhookUrl().trim());
            }
            case EMAIL -> {
                if (dto.email() == null || !EMAIL_PATTERN.matcher(dto.email().trim()).matches()) {
                    throw new WatcherValidationException("Email 格式不正確: " + dto.email());
                }
                yield NotificationTarget.email(dto.email().trim());
            }
        };
    }

    private static boolean samePrice(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) {
            return Objects.equals(a, b);
        }
        return a.compareTo(b) == 0;
    }
}
