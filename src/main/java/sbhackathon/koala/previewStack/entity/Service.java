package sbhackathon.koala.previewStack.entity;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.OffsetDateTime;

/**
 * 백엔드에서 실제로 실행 중인 서비스.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class Service {

    private final String id;
    private final ServiceConfig config;
    private final ServiceStatus status;
    private final OffsetDateTime startedAt;

    public String getServiceName() {
        return config.getServiceName();
    }

    public ContainerType getContainerType() {
        return config.getContainerType();
    }
}
