package sbhackathon.koala.previewStack.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import sbhackathon.koala.previewStack.entity.AppName;
import sbhackathon.koala.previewStack.entity.ServiceConfig;
import sbhackathon.koala.previewStack.infra.Infrastructure;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Docker 런타임 백엔드는 없으므로 Kubernetes 런타임에서만 등록됩니다.
 */
@Service
@ConditionalOnProperty(prefix = "runtime", name = "type", havingValue = "KUBERNETES", matchIfMissing = true)
@RequiredArgsConstructor
public class AppConfigService {

    private final Infrastructure infrastructure;

    /**
     * 애플리케이션 자체에 속한 서비스(instance, replica)의 설정만 반환합니다.
     * companion 서비스는 제외하며, 백엔드가 돌려준 순서를 유지합니다.
     */
    public List<ServiceConfig> getConfigsOfApp(AppName appName) {
        return infrastructure.getServices()
                .getOrDefault(appName, List.of())
                .stream()
                .filter(service -> service.getContainerType().isApplicationConfig())
                .map(sbhackathon.koala.previewStack.entity.Service::getConfig)
                .collect(Collectors.toList());
    }
}
