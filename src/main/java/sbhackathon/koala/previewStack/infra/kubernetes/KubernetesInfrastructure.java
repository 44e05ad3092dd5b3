package sbhackathon.koala.previewStack.infra.kubernetes;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1ContainerPort;
import io.kubernetes.client.openapi.models.V1Deployment;
import io.kubernetes.client.openapi.models.V1EnvVar;
import io.kubernetes.client.openapi.models.V1Namespace;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaim;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1Secret;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import sbhackathon.koala.previewStack.config.ContainerConfig;
import sbhackathon.koala.previewStack.config.KubernetesConfig;
import sbhackathon.koala.previewStack.config.KubernetesConfig.RegistryCredentials;
import sbhackathon.koala.previewStack.config.RuntimeConfig;
import sbhackathon.koala.previewStack.deployment.DeployableService;
import sbhackathon.koala.previewStack.deployment.DeploymentUnit;
import sbhackathon.koala.previewStack.entity.AppName;
import sbhackathon.koala.previewStack.entity.ContainerType;
import sbhackathon.koala.previewStack.entity.Environment;
import sbhackathon.koala.previewStack.entity.EnvironmentVariable;
import sbhackathon.koala.previewStack.entity.LogLine;
import sbhackathon.koala.previewStack.entity.Service;
import sbhackathon.koala.previewStack.entity.ServiceConfig;
import sbhackathon.koala.previewStack.entity.ServiceStatus;
import sbhackathon.koala.previewStack.exception.TraefikRuleParseException;
import sbhackathon.koala.previewStack.infra.AppLockManager;
import sbhackathon.koala.previewStack.infra.Infrastructure;
import sbhackathon.koala.previewStack.infra.KubernetesApiExecutor;
import sbhackathon.koala.previewStack.infra.Labels;
import sbhackathon.koala.previewStack.infra.kubernetes.crd.IngressRoute;
import sbhackathon.koala.previewStack.infra.kubernetes.crd.Middleware;
import sbhackathon.koala.previewStack.infra.traefik.TraefikIngressRoute;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Kubernetes 백엔드. 애플리케이션마다 네임스페이스를 하나 만들고, 서비스마다 Deployment, Service,
 * Traefik IngressRoute를 server-side apply로 적용합니다.
 */
@Slf4j
@org.springframework.stereotype.Service
@ConditionalOnProperty(prefix = "runtime", name = "type", havingValue = "KUBERNETES", matchIfMissing = true)
public class KubernetesInfrastructure implements Infrastructure {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Map<String, Object>>> REPLICATED_ENV_TYPE = new TypeReference<>() {
    };

    private final KubernetesApiExecutor executor;
    private final KubernetesConfig kubernetesConfig;
    private final RuntimeConfig runtimeConfig;
    private final AppLockManager appLockManager;
    private final Clock clock;

    public KubernetesInfrastructure(KubernetesApiExecutor executor,
                                    KubernetesConfig kubernetesConfig,
                                    RuntimeConfig runtimeConfig,
                                    AppLockManager appLockManager,
                                    Clock clock) {
        this.executor = executor;
        this.kubernetesConfig = kubernetesConfig;
        this.runtimeConfig = runtimeConfig;
        this.appLockManager = appLockManager;
        this.clock = clock;
    }

    @Override
    public Map<AppName, List<Service>> getServices() {
        Map<AppName, List<Service>> services = new TreeMap<>();

        for (V1Deployment deployment : executor.list(V1Deployment.class, null, Labels.APP_NAME)) {
            String appLabel = label(deployment, Labels.APP_NAME);
            if (!AppName.isValid(appLabel)) {
                log.warn("잘못된 app-name 라벨을 가진 Deployment 무시: {}", deployment.getMetadata().getName());
                continue;
            }

            toService(deployment).ifPresent(service ->
                    services.computeIfAbsent(AppName.of(appLabel), app -> new ArrayList<>()).add(service));
        }
        return services;
    }

    @Override
    public List<Service> deployServices(String statusId, DeploymentUnit deploymentUnit, ContainerConfig containerConfig) {
        AppName appName = deploymentUnit.getAppName();

        return appLockManager.withLock(appName, () -> {
            log.info("배포 시작 [{}] - 앱: {}, 서비스 개수: {}",
                    statusId, appName, deploymentUnit.getServices().size());

            executor.apply(KubernetesPayloads.namespacePayload(appName, runtimeConfig));
            boolean useImagePullSecret = applyImagePullSecret(appName, deploymentUnit);

            List<Service> deployed = new ArrayList<>();
            for (DeployableService service : deploymentUnit.getServices()) {
                deployed.add(deployService(appName, service, containerConfig, useImagePullSecret));
                log.info("서비스 배포 완료 [{}]: {}/{}", statusId, appName, service.getServiceName());
            }

            log.info("모든 서비스 배포 완료 [{}] - 앱: {}", statusId, appName);
            return deployed;
        });
    }

    private Service deployService(AppName appName,
                                  DeployableService service,
                                  ContainerConfig containerConfig,
                                  boolean useImagePullSecret) {
        if (service.getConfig().hasFiles()) {
            executor.apply(KubernetesPayloads.secretsPayload(appName, service.getConfig(), service.getFiles()));
        }

        Map<String, V1PersistentVolumeClaim> claims = new LinkedHashMap<>();
        for (String declaredVolume : service.getDeclaredVolumes()) {
            claims.put(declaredVolume, findOrCreatePersistentVolumeClaim(appName, service, declaredVolume));
        }

        V1ObjectMeta metadata = executor.apply(KubernetesPayloads.deploymentPayload(
                appName, service, containerConfig, useImagePullSecret, claims, clock));
        executor.apply(KubernetesPayloads.servicePayload(appName, service.getConfig()));

        if (service.getIngressRoute().isEmpty()) {
            log.debug("IngressRoute가 없는 서비스: {}/{}", appName, service.getServiceName());
        } else {
            for (Middleware middleware : KubernetesPayloads.middlewarePayloads(appName, service)) {
                executor.apply(middleware);
            }
            executor.apply(KubernetesPayloads.ingressRoutePayload(appName, service));
        }

        return Service.builder()
                .id(metadata != null ? metadata.getUid() : null)
                .config(service.getConfig())
                .status(ServiceStatus.RUNNING)
                .startedAt(metadata != null && metadata.getCreationTimestamp() != null
                        ? metadata.getCreationTimestamp()
                        : OffsetDateTime.now(clock))
                .build();
    }

    /**
     * PVC 이름은 매번 생성되므로 라벨(app, service, storage-type)로 기존 PVC를 찾고, 없을 때만 새로 만듭니다.
     */
    private V1PersistentVolumeClaim findOrCreatePersistentVolumeClaim(AppName appName,
                                                                      DeployableService service,
                                                                      String declaredVolume) {
        String namespace = appName.toRfc1123NamespaceId();
        String selector = KubernetesPayloads.labelSelector(
                KubernetesPayloads.storageLabels(appName, service.getServiceName(), declaredVolume));

        List<V1PersistentVolumeClaim> existing = executor.list(V1PersistentVolumeClaim.class, namespace, selector);
        if (!existing.isEmpty()) {
            log.debug("기존 PVC 사용: {}", existing.get(0).getMetadata().getName());
            return existing.get(0);
        }

        KubernetesConfig.Storage storage = kubernetesConfig.getStorage();
        V1PersistentVolumeClaim claim = KubernetesPayloads.persistentVolumeClaimPayload(
                appName, service, storage.getSize(), storage.getStorageClass(), declaredVolume);
        V1ObjectMeta created = executor.create(claim);
        return created != null ? claim.metadata(created) : claim;
    }

    /**
     * 서비스 이미지가 사용하는 레지스트리의 인증 정보가 설정되어 있으면 ImagePullSecret을 적용합니다.
     *
     * @return Deployment가 ImagePullSecret을 참조해야 하는지 여부
     */
    private boolean applyImagePullSecret(AppName appName, DeploymentUnit deploymentUnit) {
        Map<String, RegistryCredentials> credentials = new LinkedHashMap<>();
        for (DeployableService service : deploymentUnit.getServices()) {
            String registry = registryHost(service.getImage());
            RegistryCredentials registryCredentials = kubernetesConfig.getRegistries().get(registry);
            if (registryCredentials != null) {
                credentials.put(registry, registryCredentials);
            }
        }

        if (credentials.isEmpty()) {
            return false;
        }

        V1Secret secret = KubernetesPayloads.imagePullSecretPayload(appName, credentials);
        String namespace = appName.toRfc1123NamespaceId();
        String name = secret.getMetadata().getName();

        // immutable Secret은 내용을 바꿀 수 없으므로 변경된 경우에만 삭제 후 다시 만듭니다
        Optional<V1Secret> existing = executor.get(V1Secret.class, namespace, name);
        if (existing.isPresent()) {
            if (sameData(existing.get(), secret)) {
                return true;
            }
            executor.delete(V1Secret.class, namespace, name);
        }
        executor.apply(secret);
        return true;
    }

    private static boolean sameData(V1Secret existing, V1Secret desired) {
        if (existing.getData() == null) {
            return false;
        }
        return Arrays.equals(
                existing.getData().get(KubernetesPayloads.DOCKER_CONFIG_JSON_KEY),
                desired.getData().get(KubernetesPayloads.DOCKER_CONFIG_JSON_KEY));
    }

    /**
     * 이미지 참조에서 레지스트리 호스트를 꺼냅니다. 호스트가 없으면 docker.io입니다.
     */
    static String registryHost(String image) {
        int slash = image.indexOf('/');
        if (slash < 0) {
            return "docker.io";
        }
        String candidate = image.substring(0, slash);
        if (candidate.contains(".") || candidate.contains(":") || candidate.equals("localhost")) {
            return candidate;
        }
        return "docker.io";
    }

    @Override
    public Optional<List<Service>> getStatusChange(String statusId) {
        // server-side apply는 동기적으로 반영되므로 추적할 상태 변화가 없습니다
        return Optional.empty();
    }

    @Override
    public List<Service> stopServices(String statusId, AppName appName) {
        return appLockManager.withLock(appName, () -> {
            String namespace = appName.toRfc1123NamespaceId();
            List<Service> services = new ArrayList<>();
            for (V1Deployment deployment : executor.list(V1Deployment.class, namespace,
                    Labels.APP_NAME + "=" + appName.getValue())) {
                toService(deployment).ifPresent(services::add);
            }

            if (services.isEmpty()) {
                log.info("중지할 서비스가 없습니다 [{}]: {}", statusId, appName);
                return services;
            }

            log.info("서비스 중지 [{}] - 앱: {}, 서비스 개수: {}", statusId, appName, services.size());
            executor.delete(V1Namespace.class, null, namespace);
            return services;
        });
    }

    @Override
    public Optional<List<LogLine>> getLogs(AppName appName, String serviceName, OffsetDateTime from, int limit) {
        String namespace = appName.toRfc1123NamespaceId();
        String selector = Labels.APP_NAME + "=" + appName.getValue() + "," + Labels.SERVICE_NAME + "=" + serviceName;

        Optional<V1Pod> pod = executor.list(V1Pod.class, namespace, selector).stream()
                .max(Comparator.comparing(KubernetesInfrastructure::creationTimestamp,
                        Comparator.nullsFirst(Comparator.naturalOrder())));
        if (pod.isEmpty()) {
            return Optional.empty();
        }

        Integer sinceSeconds = null;
        if (from != null) {
            long seconds = Duration.between(from, OffsetDateTime.now(clock)).getSeconds();
            sinceSeconds = (int) Math.max(1, Math.min(seconds + 1, Integer.MAX_VALUE));
        }

        return executor.readPodLog(namespace, pod.get().getMetadata().getName(), sinceSeconds)
                .map(podLog -> parseLogLines(podLog, from, limit));
    }

    /**
     * {@code timestamps=true}로 읽은 로그를 파싱합니다. 각 줄은 RFC3339 타임스탬프와 공백으로 시작합니다.
     */
    static List<LogLine> parseLogLines(String podLog, OffsetDateTime from, int limit) {
        List<LogLine> lines = new ArrayList<>();
        for (String line : podLog.split("\n")) {
            if (lines.size() >= limit) {
                break;
            }
            int space = line.indexOf(' ');
            if (space <= 0) {
                continue;
            }

            OffsetDateTime timestamp;
            try {
                timestamp = OffsetDateTime.parse(line.substring(0, space));
            } catch (DateTimeParseException e) {
                continue;
            }
            if (from != null && timestamp.isBefore(from)) {
                continue;
            }
            lines.add(new LogLine(timestamp, line.substring(space + 1)));
        }
        return lines;
    }

    @Override
    public Optional<Service> changeStatus(AppName appName, String serviceName, ServiceStatus status) {
        return appLockManager.withLock(appName, () -> {
            Optional<Service> service = executor.get(V1Deployment.class, appName.toRfc1123NamespaceId(),
                            KubernetesPayloads.deploymentName(appName, serviceName))
                    .flatMap(this::toService);
            if (service.isEmpty()) {
                return Optional.<Service>empty();
            }

            int replicas = status == ServiceStatus.PAUSED ? 0 : 1;
            log.info("서비스 상태 변경: {}/{} -> {} (replicas: {})", appName, serviceName, status, replicas);
            executor.applyScale(
                    KubernetesPayloads.deploymentReplicasPayload(appName, service.get().getConfig(), replicas));
            return Optional.of(service.get().toBuilder().status(status).build());
        });
    }

    @Override
    public Optional<TraefikIngressRoute> baseTraefikIngressRoute() {
        KubernetesConfig.BaseIngressRoute base = kubernetesConfig.getBaseIngressRoute();
        if (!base.isConfigured()) {
            return Optional.empty();
        }

        Optional<IngressRoute> ingressRoute = executor.get(IngressRoute.class, base.getNamespace(), base.getName());
        if (ingressRoute.isEmpty()) {
            log.warn("Base IngressRoute {}/{}를 찾을 수 없습니다", base.getNamespace(), base.getName());
            return Optional.empty();
        }

        try {
            return Optional.of(TraefikIngressRoutes.fromIngressRoute(ingressRoute.get()));
        } catch (TraefikRuleParseException e) {
            log.warn("Base IngressRoute {}/{}를 해석할 수 없습니다: {}",
                    base.getNamespace(), base.getName(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Deployment로부터 실행 중인 서비스 정보를 복원합니다. 라벨이 올바르지 않으면 비어 있습니다.
     */
    private Optional<Service> toService(V1Deployment deployment) {
        String serviceName = label(deployment, Labels.SERVICE_NAME);
        String containerTypeLabel = label(deployment, Labels.CONTAINER_TYPE);
        if (serviceName == null) {
            return Optional.empty();
        }

        ContainerType containerType;
        try {
            containerType = containerTypeLabel != null
                    ? ContainerType.fromLabel(containerTypeLabel)
                    : ContainerType.INSTANCE;
        } catch (IllegalArgumentException e) {
            log.warn("알 수 없는 container-type 라벨 무시: {} ({})", containerTypeLabel, serviceName);
            return Optional.empty();
        }

        V1Container container = deployment.getSpec() != null
                && deployment.getSpec().getTemplate() != null
                && deployment.getSpec().getTemplate().getSpec() != null
                && !deployment.getSpec().getTemplate().getSpec().getContainers().isEmpty()
                ? deployment.getSpec().getTemplate().getSpec().getContainers().get(0)
                : null;

        Map<String, String> annotations = deployment.getMetadata().getAnnotations() != null
                ? deployment.getMetadata().getAnnotations()
                : Map.of();
        String image = annotations.getOrDefault(Labels.IMAGE, container != null ? container.getImage() : null);
        if (image == null) {
            return Optional.empty();
        }

        Integer port = container != null && container.getPorts() != null && !container.getPorts().isEmpty()
                ? container.getPorts().stream().map(V1ContainerPort::getContainerPort).findFirst().orElse(null)
                : null;

        ServiceConfig config = ServiceConfig.builder()
                .serviceName(serviceName)
                .image(image)
                .port(port)
                .containerType(containerType)
                .env(environment(container, annotations.get(Labels.REPLICATED_ENV)))
                .build();

        Integer replicas = deployment.getSpec() != null ? deployment.getSpec().getReplicas() : null;
        return Optional.of(Service.builder()
                .id(deployment.getMetadata().getUid())
                .config(config)
                .status(replicas != null && replicas == 0 ? ServiceStatus.PAUSED : ServiceStatus.RUNNING)
                .startedAt(deployment.getMetadata().getCreationTimestamp())
                .build());
    }

    private static Environment environment(V1Container container, String replicatedEnvJson) {
        if (container == null || container.getEnv() == null) {
            return Environment.empty();
        }

        Map<String, Map<String, Object>> replicated = Map.of();
        if (replicatedEnvJson != null) {
            try {
                replicated = OBJECT_MAPPER.readValue(replicatedEnvJson, REPLICATED_ENV_TYPE);
            } catch (JsonProcessingException e) {
                log.warn("replicated-env annotation을 해석할 수 없습니다: {}", e.getMessage());
            }
        }

        List<EnvironmentVariable> variables = new ArrayList<>();
        for (V1EnvVar env : container.getEnv()) {
            Map<String, Object> replicatedValue = replicated.get(env.getName());
            boolean templated = replicatedValue != null && Boolean.TRUE.equals(replicatedValue.get("templated"));
            boolean replicate = replicatedValue != null && Boolean.TRUE.equals(replicatedValue.get("replicate"));
            variables.add(new EnvironmentVariable(env.getName(), env.getValue(), templated, replicate));
        }
        return new Environment(variables);
    }

    private static String label(V1Deployment deployment, String key) {
        Map<String, String> labels = deployment.getMetadata() != null ? deployment.getMetadata().getLabels() : null;
        return labels != null ? labels.get(key) : null;
    }

    private static OffsetDateTime creationTimestamp(V1Pod pod) {
        return pod.getMetadata() != null ? pod.getMetadata().getCreationTimestamp() : null;
    }
}
