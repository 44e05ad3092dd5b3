package sbhackathon.koala.previewStack.infra;

import sbhackathon.koala.previewStack.config.ContainerConfig;
import sbhackathon.koala.previewStack.deployment.DeploymentUnit;
import sbhackathon.koala.previewStack.entity.AppName;
import sbhackathon.koala.previewStack.entity.LogLine;
import sbhackathon.koala.previewStack.entity.Service;
import sbhackathon.koala.previewStack.entity.ServiceStatus;
import sbhackathon.koala.previewStack.infra.traefik.TraefikIngressRoute;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 오케스트레이션 백엔드마다 하나씩 구현하는 공통 계약.
 * <p>
 * 실패는 {@link sbhackathon.koala.previewStack.exception.InfrastructureException}으로 전달합니다.
 * {@link Optional#empty()}는 "해당 없음"을 뜻하며 일시적인 오류를 표현하는 데 쓰지 않습니다.
 */
public interface Infrastructure {

    /**
     * 애플리케이션별로 현재 실행 중인 서비스를 반환합니다. 항상 백엔드의 현재 상태를 조회하며 캐시하지 않습니다.
     */
    Map<AppName, List<Service>> getServices();

    /**
     * 배포 단위의 서비스들을 배포합니다.
     * <p>
     * 구현체는 다음을 보장해야 합니다.
     * <ul>
     *     <li>같은 애플리케이션의 서비스끼리 서비스 이름으로 통신할 수 있어야 합니다 (예: {@code ping <service_name>}).</li>
     *     <li>이미 실행 중인 서비스는 중복 생성하지 않고 다시 배포합니다.</li>
     *     <li>배포된 서비스는 같은 애플리케이션 이름으로 {@link #getServices()}, {@link #stopServices} 에서 찾을 수 있어야 합니다.</li>
     * </ul>
     *
     * @param statusId 호출 추적용 ID
     */
    List<Service> deployServices(String statusId, DeploymentUnit deploymentUnit, ContainerConfig containerConfig);

    /**
     * 비동기로 적용되는 백엔드에서 배포 진행 상황을 조회합니다.
     * 지원하지 않는 백엔드는 {@link Optional#empty()}를 반환합니다.
     */
    Optional<List<Service>> getStatusChange(String statusId);

    /**
     * 애플리케이션의 서비스를 모두 중지하고, 실제로 중지된 서비스만 반환합니다.
     */
    List<Service> stopServices(String statusId, AppName appName);

    /**
     * 타임스탬프가 포함된 로그 라인을 반환합니다.
     * 로그를 가져올 수 없는 서비스(아직 Pod가 없는 경우 등)는 {@link Optional#empty()}입니다.
     *
     * @param from  이 시각 이후의 로그만 반환. null이면 처음부터
     * @param limit 최대 라인 수
     */
    Optional<List<LogLine>> getLogs(AppName appName, String serviceName, OffsetDateTime from, int limit);

    /**
     * 서비스를 일시정지하거나 다시 시작합니다. 서비스가 없으면 {@link Optional#empty()}입니다.
     */
    Optional<Service> changeStatus(AppName appName, String serviceName, ServiceStatus status);

    /**
     * 이 시스템의 API로 들어오는 <a href="https://doc.traefik.io/traefik/routing/routers/">router rule</a>.
     * 배포되는 서비스도 같은 규칙(예: 호스트 이름)으로 접근할 수 있도록 사용합니다.
     * 알 수 없는 백엔드는 {@link Optional#empty()}를 반환합니다.
     */
    Optional<TraefikIngressRoute> baseTraefikIngressRoute();
}
