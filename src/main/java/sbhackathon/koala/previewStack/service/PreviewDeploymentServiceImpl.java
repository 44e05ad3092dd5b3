package sbhackathon.koala.previewStack.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import sbhackathon.koala.previewStack.config.ContainerConfig;
import sbhackathon.koala.previewStack.deployment.DeployableService;
import sbhackathon.koala.previewStack.deployment.DeploymentStrategy;
import sbhackathon.koala.previewStack.deployment.DeploymentUnit;
import sbhackathon.koala.previewStack.dto.DeploymentRequest;
import sbhackathon.koala.previewStack.dto.ServiceDeployRequest;
import sbhackathon.koala.previewStack.entity.AppName;
import sbhackathon.koala.previewStack.entity.ContainerType;
import sbhackathon.koala.previewStack.entity.Environment;
import sbhackathon.koala.previewStack.entity.EnvironmentVariable;
import sbhackathon.koala.previewStack.entity.ServiceConfig;
import sbhackathon.koala.previewStack.infra.Infrastructure;
import sbhackathon.koala.previewStack.infra.traefik.TraefikIngressRoute;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
@ConditionalOnProperty(prefix = "runtime", name = "type", havingValue = "KUBERNETES", matchIfMissing = true)
public class PreviewDeploymentServiceImpl implements PreviewDeploymentService {

    private static final Logger logger = LoggerFactory.getLogger(PreviewDeploymentServiceImpl.class);

    private final Infrastructure infrastructure;
    private final AppConfigService appConfigService;
    private final ContainerConfig containerConfig;

    public PreviewDeploymentServiceImpl(Infrastructure infrastructure,
                                        AppConfigService appConfigService,
                                        ContainerConfig containerConfig) {
        this.infrastructure = infrastructure;
        this.appConfigService = appConfigService;
        this.containerConfig = containerConfig;
    }

    @Override
    public List<sbhackathon.koala.previewStack.entity.Service> deploy(DeploymentRequest request) {
        AppName appName = AppName.of(request.getAppName());
        logger.info("배포 요청 - 앱: {}, 서비스 개수: {}", appName, request.getServices().size());

        // 모든 서비스의 라우팅 규칙 앞에 이 시스템의 base route를 결합합니다
        TraefikIngressRoute baseRoute = infrastructure.baseTraefikIngressRoute()
                .orElse(new TraefikIngressRoute(List.of(), List.of()));

        List<DeployableService> services = new ArrayList<>();
        for (ServiceDeployRequest serviceRequest : request.getServices()) {
            services.add(toDeployableService(appName, serviceRequest, baseRoute));
        }

        String statusId = UUID.randomUUID().toString();
        return infrastructure.deployServices(statusId, new DeploymentUnit(appName, services), containerConfig);
    }

    private DeployableService toDeployableService(AppName appName,
                                                  ServiceDeployRequest request,
                                                  TraefikIngressRoute baseRoute) {
        ServiceConfig config = ServiceConfig.builder()
                .serviceName(request.getServiceName())
                .image(request.getImage())
                .port(request.getPort())
                .containerType(request.getContainerType() != null
                        ? ContainerType.fromLabel(request.getContainerType())
                        : ContainerType.INSTANCE)
                .env(toEnvironment(request))
                .files(toFiles(request.getFiles()))
                .build();

        TraefikIngressRoute ingressRoute = TraefikIngressRoute
                .withDefaults(appName, config.getServiceName())
                .merge(baseRoute);

        return new DeployableService(config, toStrategy(request), ingressRoute,
                request.getVolumes() != null ? request.getVolumes() : List.of());
    }

    private static Environment toEnvironment(ServiceDeployRequest request) {
        if (request.getEnv() == null) {
            return Environment.empty();
        }

        List<String> replicated = request.getReplicatedEnv() != null ? request.getReplicatedEnv() : List.of();
        List<EnvironmentVariable> variables = new ArrayList<>();
        request.getEnv().forEach((key, value) -> variables.add(replicated.contains(key)
                ? EnvironmentVariable.replicated(key, value)
                : new EnvironmentVariable(key, value)));
        return new Environment(variables);
    }

    private static Map<Path, String> toFiles(Map<String, String> files) {
        Map<Path, String> result = new LinkedHashMap<>();
        if (files == null) {
            return result;
        }

        files.forEach((path, content) -> {
            Path filePath = Path.of(path);
            if (!filePath.isAbsolute()) {
                throw new IllegalArgumentException("File path must be absolute: " + path);
            }
            // 파일은 상위 디렉터리 단위로 마운트되므로 루트 바로 아래 파일은 둘 수 없습니다
            if (filePath.getNameCount() < 2) {
                throw new IllegalArgumentException("File path must be inside a directory: " + path);
            }
            result.put(filePath, content);
        });
        return result;
    }

    private static DeploymentStrategy toStrategy(ServiceDeployRequest request) {
        String redeploy = request.getRedeploy() != null ? request.getRedeploy() : "image-update";
        switch (redeploy) {
            case "never":
                return DeploymentStrategy.redeployNever();
            case "always":
                return DeploymentStrategy.redeployAlways();
            case "image-update":
                if (request.getImageHash() == null) {
                    // 해시를 모르면 이미지가 바뀌었는지 판단할 수 없으므로 항상 재배포합니다
                    return DeploymentStrategy.redeployAlways();
                }
                return DeploymentStrategy.redeployOnImageUpdate(request.getImageHash());
            default:
                throw new IllegalArgumentException("Unknown redeploy strategy: " + redeploy);
        }
    }

    @Override
    public List<sbhackathon.koala.previewStack.entity.Service> stop(String appName) {
        String statusId = UUID.randomUUID().toString();
        List<sbhackathon.koala.previewStack.entity.Service> stopped =
                infrastructure.stopServices(statusId, AppName.of(appName));
        logger.info("서비스 중지 완료 - 앱: {}, 중지된 서비스 개수: {}", appName, stopped.size());
        return stopped;
    }

    @Override
    public List<ServiceConfig> getConfigsOfApp(String appName) {
        return appConfigService.getConfigsOfApp(AppName.of(appName));
    }
}
