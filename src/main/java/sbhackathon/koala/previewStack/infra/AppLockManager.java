package sbhackathon.koala.previewStack.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import sbhackathon.koala.previewStack.entity.AppName;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 애플리케이션 단위 락 (단일 인스턴스용).
 * <p>
 * 같은 애플리케이션에 대한 배포/중지가 동시에 실행되면 네임스페이스 생성과 삭제가 엇갈릴 수 있으므로
 * 정규화된 애플리케이션 이름 기준으로 직렬화합니다. 다른 애플리케이션끼리는 서로 막지 않습니다.
 * <p>
 * 락은 사용 중이거나 대기 중인 스레드가 있는 애플리케이션에만 유지하고, 마지막 사용자가 빠지면 제거합니다.
 */
@Slf4j
@Component
public class AppLockManager {

    private final ConcurrentMap<String, AppLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(AppName appName, Supplier<T> action) {
        String key = appName.toRfc1123NamespaceId();
        AppLock appLock = acquire(key);
        ReentrantLock lock = appLock.lock;

        try {
            if (lock.isLocked() && !lock.isHeldByCurrentThread()) {
                log.info("App lock 대기 중: {}", key);
            }
            lock.lock();
            try {
                return action.get();
            } finally {
                lock.unlock();
            }
        } finally {
            release(key);
        }
    }

    public boolean isLocked(AppName appName) {
        AppLock appLock = locks.get(appName.toRfc1123NamespaceId());
        return appLock != null && appLock.lock.isLocked();
    }

    /**
     * 현재 락을 유지하고 있는 애플리케이션 수.
     */
    int size() {
        return locks.size();
    }

    // compute는 키 단위로 원자적이므로 users 증감과 제거가 엇갈리지 않습니다
    private AppLock acquire(String key) {
        return locks.compute(key, (k, appLock) -> {
            AppLock acquired = appLock != null ? appLock : new AppLock();
            acquired.users++;
            return acquired;
        });
    }

    private void release(String key) {
        locks.computeIfPresent(key, (k, appLock) -> --appLock.users == 0 ? null : appLock);
    }

    private static final class AppLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
