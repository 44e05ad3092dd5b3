package sbhackathon.koala.previewStack.infra.kubernetes;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.kubernetes.client.custom.IntOrString;
import io.kubernetes.client.custom.Quantity;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1ContainerPort;
import io.kubernetes.client.openapi.models.V1Deployment;
import io.kubernetes.client.openapi.models.V1DeploymentSpec;
import io.kubernetes.client.openapi.models.V1EnvVar;
import io.kubernetes.client.openapi.models.V1KeyToPath;
import io.kubernetes.client.openapi.models.V1LabelSelector;
import io.kubernetes.client.openapi.models.V1LocalObjectReference;
import io.kubernetes.client.openapi.models.V1Namespace;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaim;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaimSpec;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaimVolumeSource;
import io.kubernetes.client.openapi.models.V1PodSpec;
import io.kubernetes.client.openapi.models.V1PodTemplateSpec;
import io.kubernetes.client.openapi.models.V1ResourceRequirements;
import io.kubernetes.client.openapi.models.V1Secret;
import io.kubernetes.client.openapi.models.V1SecretVolumeSource;
import io.kubernetes.client.openapi.models.V1Service;
import io.kubernetes.client.openapi.models.V1ServicePort;
import io.kubernetes.client.openapi.models.V1ServiceSpec;
import io.kubernetes.client.openapi.models.V1Volume;
import io.kubernetes.client.openapi.models.V1VolumeMount;
import io.kubernetes.client.openapi.models.V1VolumeResourceRequirements;
import org.springframework.util.unit.DataSize;
import sbhackathon.koala.previewStack.config.ContainerConfig;
import sbhackathon.koala.previewStack.config.KubernetesConfig.RegistryCredentials;
import sbhackathon.koala.previewStack.config.RuntimeConfig;
import sbhackathon.koala.previewStack.deployment.DeployableService;
import sbhackathon.koala.previewStack.entity.AppName;
import sbhackathon.koala.previewStack.entity.EnvironmentVariable;
import sbhackathon.koala.previewStack.entity.ServiceConfig;
import sbhackathon.koala.previewStack.exception.InternalInvariantException;
import sbhackathon.koala.previewStack.infra.Labels;
import sbhackathon.koala.previewStack.infra.kubernetes.crd.IngressRoute;
import sbhackathon.koala.previewStack.infra.kubernetes.crd.Middleware;
import sbhackathon.koala.previewStack.infra.traefik.TraefikMiddleware;
import sbhackathon.koala.previewStack.infra.traefik.TraefikRoute;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 배포 설명으로부터 Kubernetes 리소스 페이로드를 만드는 함수 모음.
 * <p>
 * 모든 함수는 상태가 없고 입력이 같으면 같은 페이로드를 만듭니다. 예외는 현재 시각을 기록하는
 * {@code REDEPLOY_ALWAYS} annotation과 PVC의 generateName 뿐입니다.
 */
public final class KubernetesPayloads {

    public static final String IMAGE_PULL_SECRET_TYPE = "kubernetes.io/dockerconfigjson";
    public static final String DOCKER_CONFIG_JSON_KEY = ".dockerconfigjson";
    public static final String ENTRY_POINTS_ANNOTATION = "traefik.ingress.kubernetes.io/router.entrypoints";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private KubernetesPayloads() {
    }

    /**
     * 애플리케이션마다 하나씩 만드는 Namespace.
     * 설정된 annotation이 없으면 annotations 필드 자체를 생략합니다.
     */
    public static V1Namespace namespacePayload(AppName appName, RuntimeConfig runtimeConfig) {
        Map<String, String> annotations = runtimeConfig.namespaceAnnotations();

        return new V1Namespace()
                .apiVersion("v1")
                .kind("Namespace")
                .metadata(new V1ObjectMeta()
                        .name(appName.toRfc1123NamespaceId())
                        .labels(Map.of(Labels.APP_NAME, appName.getValue()))
                        .annotations(annotations == null || annotations.isEmpty()
                                ? null
                                : new LinkedHashMap<>(annotations)));
    }

    /**
     * Deployment 페이로드를 만듭니다.
     *
     * @param persistentVolumeClaims 마운트 경로 -> 바인딩할 PVC. 없으면 빈 Map
     * @param clock                  REDEPLOY_ALWAYS 전략의 annotation에 기록할 시각
     */
    public static V1Deployment deploymentPayload(AppName appName,
                                                 DeployableService service,
                                                 ContainerConfig containerConfig,
                                                 boolean useImagePullSecret,
                                                 Map<String, V1PersistentVolumeClaim> persistentVolumeClaims,
                                                 Clock clock) {
        String namespace = appName.toRfc1123NamespaceId();
        Map<String, String> labels = serviceLabels(appName, service.getConfig());

        Map<String, String> annotations = new LinkedHashMap<>();
        annotations.put(Labels.IMAGE, service.getImage());
        if (service.getEnv().hasReplicatedVariables()) {
            annotations.put(Labels.REPLICATED_ENV, replicatedEnvironmentJson(service.getConfig()));
        }

        List<V1Volume> volumes = new ArrayList<>();
        List<V1VolumeMount> volumeMounts = new ArrayList<>();

        Map<Path, List<Path>> filesByParent = filesByParent(service.getFiles().keySet());
        String secretName = fileSecretName(appName, service.getServiceName());
        filesByParent.forEach((parent, paths) -> {
            String volumeName = SecretNames.fromPath(parent);
            List<V1KeyToPath> items = paths.stream()
                    .map(path -> new V1KeyToPath()
                            .key(SecretNames.fromFileName(path))
                            .path(path.getFileName().toString()))
                    .collect(Collectors.toList());

            volumes.add(new V1Volume()
                    .name(volumeName)
                    .secret(new V1SecretVolumeSource()
                            .secretName(secretName)
                            .items(items)));
            volumeMounts.add(new V1VolumeMount()
                    .name(volumeName)
                    .mountPath(parent.toString()));
        });

        // 파일 볼륨이 없어도 선언된 영구 볼륨은 항상 마운트합니다
        if (persistentVolumeClaims != null) {
            for (String declaredVolume : service.getDeclaredVolumes()) {
                V1PersistentVolumeClaim claim = persistentVolumeClaims.get(declaredVolume);
                if (claim == null) {
                    continue;
                }
                volumes.add(pvcVolumePayload(claim));
                volumeMounts.add(pvcVolumeMountPayload(declaredVolume, claim));
            }
        }

        List<V1EnvVar> env = service.getEnv().getVariables().stream()
                .map(variable -> new V1EnvVar()
                        .name(variable.getKey())
                        .value(variable.getValue()))
                .collect(Collectors.toList());

        V1Container container = new V1Container()
                .name(service.getServiceName())
                .image(service.getImage())
                .imagePullPolicy("Always")
                .env(env.isEmpty() ? null : env)
                .volumeMounts(volumeMounts.isEmpty() ? null : volumeMounts)
                .ports(List.of(new V1ContainerPort().containerPort(service.getPort())))
                .resources(containerConfig.memoryLimit()
                        .map(KubernetesPayloads::memoryLimits)
                        .orElse(null));

        // 모델의 빈 컬렉션 기본값이 apply 페이로드에 실리지 않도록 null로 둡니다
        V1PodSpec podSpec = new V1PodSpec()
                .containers(List.of(container))
                .volumes(volumes.isEmpty() ? null : volumes)
                .imagePullSecrets(useImagePullSecret
                        ? List.of(new V1LocalObjectReference().name(imagePullSecretName(appName)))
                        : null);

        return new V1Deployment()
                .apiVersion("apps/v1")
                .kind("Deployment")
                .metadata(new V1ObjectMeta()
                        .name(deploymentName(appName, service.getServiceName()))
                        .namespace(namespace)
                        .labels(labels)
                        .annotations(annotations))
                .spec(new V1DeploymentSpec()
                        .replicas(1)
                        .selector(new V1LabelSelector().matchLabels(labels))
                        .template(new V1PodTemplateSpec()
                                .metadata(new V1ObjectMeta()
                                        .labels(labels)
                                        .annotations(new LinkedHashMap<>(service.getStrategy().podAnnotations(clock))))
                                .spec(podSpec)));
    }

    /**
     * replicas 필드만 바꾸는 Deployment 페이로드. server-side apply로 적용하면 다른 필드는 유지됩니다.
     */
    public static V1Deployment deploymentReplicasPayload(AppName appName, ServiceConfig config, int replicas) {
        Map<String, String> labels = serviceLabels(appName, config);

        return new V1Deployment()
                .apiVersion("apps/v1")
                .kind("Deployment")
                .metadata(new V1ObjectMeta()
                        .name(deploymentName(appName, config.getServiceName()))
                        .namespace(appName.toRfc1123NamespaceId())
                        .labels(labels)
                        .annotations(null))
                .spec(new V1DeploymentSpec()
                        .replicas(replicas)
                        .selector(new V1LabelSelector().matchLabels(labels)));
    }

    /**
     * 서비스에 마운트할 파일들을 담는 Secret. 키는 파일 이름의 {@code .}을 {@code -}로 바꾼 값입니다.
     */
    public static V1Secret secretsPayload(AppName appName, ServiceConfig config, Map<Path, String> files) {
        Map<String, byte[]> data = new LinkedHashMap<>();
        files.forEach((path, content) ->
                data.put(SecretNames.fromFileName(path), content.getBytes(StandardCharsets.UTF_8)));

        return new V1Secret()
                .apiVersion("v1")
                .kind("Secret")
                .metadata(new V1ObjectMeta()
                        .name(fileSecretName(appName, config.getServiceName()))
                        .namespace(appName.toRfc1123NamespaceId())
                        .labels(serviceLabels(appName, config)))
                .type("Opaque")
                .data(data);
    }

    /**
     * 레지스트리 인증 정보를 담은 ImagePullSecret (docker config.json 형식).
     */
    public static V1Secret imagePullSecretPayload(AppName appName,
                                                  Map<String, RegistryCredentials> registriesAndCredentials) {
        Map<String, Object> auths = new LinkedHashMap<>();
        registriesAndCredentials.forEach((registry, credentials) -> {
            // auth = base64(username:password)
            String auth = Base64.getEncoder().encodeToString(
                    (credentials.getUsername() + ":" + credentials.getPassword()).getBytes(StandardCharsets.UTF_8));

            Map<String, Object> authConfig = new LinkedHashMap<>();
            authConfig.put("username", credentials.getUsername());
            authConfig.put("password", credentials.getPassword());
            authConfig.put("auth", auth);
            auths.put(registry, authConfig);
        });

        String dockerConfigJson;
        try {
            dockerConfigJson = OBJECT_MAPPER.writeValueAsString(Map.of("auths", auths));
        } catch (JsonProcessingException e) {
            throw new InternalInvariantException("Docker config.json 생성 실패: " + e.getMessage(), e);
        }

        return new V1Secret()
                .apiVersion("v1")
                .kind("Secret")
                .metadata(new V1ObjectMeta()
                        .name(imagePullSecretName(appName))
                        .namespace(appName.toRfc1123NamespaceId())
                        .labels(Map.of(Labels.APP_NAME, appName.getValue())))
                .immutable(true)
                .type(IMAGE_PULL_SECRET_TYPE)
                .data(Map.of(DOCKER_CONFIG_JSON_KEY, dockerConfigJson.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * 서비스 이름으로 접근할 수 있게 해 주는 Service. selector는 Deployment의 라벨과 같습니다.
     */
    public static V1Service servicePayload(AppName appName, ServiceConfig config) {
        Map<String, String> labels = serviceLabels(appName, config);

        return new V1Service()
                .apiVersion("v1")
                .kind("Service")
                .metadata(new V1ObjectMeta()
                        .name(config.getServiceName())
                        .namespace(appName.toRfc1123NamespaceId())
                        .labels(labels))
                .spec(new V1ServiceSpec()
                        .ports(List.of(new V1ServicePort()
                                .name(config.getServiceName())
                                .port(config.getPort())
                                .targetPort(new IntOrString(config.getPort()))))
                        .selector(labels));
    }

    /**
     * 서비스의 모든 route를 하나의 Traefik IngressRoute로 만듭니다.
     * See <a href="https://docs.traefik.io/v2.0/user-guides/crd-acme/#traefik-routers">Traefik Routers</a>.
     *
     * @throws InternalInvariantException route가 하나도 없는 경우
     */
    public static IngressRoute ingressRoutePayload(AppName appName, DeployableService service) {
        List<TraefikRoute> routes = service.getIngressRoute().getRoutes();
        if (routes.isEmpty()) {
            throw new InternalInvariantException(
                    "IngressRoute for service " + service.getServiceName() + " of " + appName + " has no routes");
        }

        List<IngressRoute.Route> rules = routes.stream()
                .map(route -> IngressRoute.Route.builder()
                        .kind("Rule")
                        .match(route.getRule().toString())
                        .middlewares(route.getMiddlewares().stream()
                                .map(middleware -> new IngressRoute.MiddlewareRef(middlewareName(middleware)))
                                .collect(Collectors.toList()))
                        .services(List.of(IngressRoute.RouteService.builder()
                                .kind("Service")
                                .name(service.getServiceName())
                                .port(service.getPort())
                                .build()))
                        .build())
                .collect(Collectors.toList());

        Map<String, String> annotations = new LinkedHashMap<>(serviceLabels(appName, service.getConfig()));
        annotations.put(ENTRY_POINTS_ANNOTATION, "web");

        List<String> entryPoints = service.getIngressRoute().getEntryPoints();
        IngressRoute.Tls tls = routes.stream()
                .map(TraefikRoute::getCertResolver)
                .filter(resolver -> resolver != null)
                .findFirst()
                .map(IngressRoute.Tls::new)
                .orElse(null);

        return IngressRoute.builder()
                .metadata(new V1ObjectMeta()
                        .name(ingressRouteName(appName, service.getServiceName()))
                        .namespace(appName.toRfc1123NamespaceId())
                        .annotations(annotations))
                .spec(IngressRoute.Spec.builder()
                        .entryPoints(entryPoints.isEmpty() ? null : entryPoints)
                        .routes(rules)
                        .tls(tls)
                        .build())
                .build();
    }

    /**
     * route에 인라인으로 정의된 middleware마다 Middleware 오브젝트를 하나씩 만듭니다. 참조({@code Ref})는 만들지 않습니다.
     */
    public static List<Middleware> middlewarePayloads(AppName appName, DeployableService service) {
        Map<String, Map<String, Object>> specs = new LinkedHashMap<>();
        for (TraefikRoute route : service.getIngressRoute().getRoutes()) {
            for (TraefikMiddleware middleware : route.getMiddlewares()) {
                if (middleware instanceof TraefikMiddleware.Spec) {
                    specs.putIfAbsent(middlewareName(middleware), ((TraefikMiddleware.Spec) middleware).getSpec());
                }
            }
        }

        return specs.entrySet().stream()
                .map(entry -> Middleware.builder()
                        .metadata(new V1ObjectMeta()
                                .name(entry.getKey())
                                .namespace(appName.toRfc1123NamespaceId()))
                        .spec(entry.getValue())
                        .build())
                .collect(Collectors.toList());
    }

    /**
     * middleware 이름을 결정합니다. 인라인 spec의 이름은 애플리케이션 이름일 수 있으므로
     * 애플리케이션 이름과 같은 규칙으로 정규화합니다.
     */
    public static String middlewareName(TraefikMiddleware middleware) {
        if (middleware instanceof TraefikMiddleware.Spec && AppName.isValid(middleware.getName())) {
            return AppName.normalize(middleware.getName());
        }
        return middleware.getName();
    }

    public static V1VolumeMount pvcVolumeMountPayload(String path, V1PersistentVolumeClaim claim) {
        return new V1VolumeMount()
                .name(pvcVolumeName(claim))
                .mountPath(path);
    }

    public static V1Volume pvcVolumePayload(V1PersistentVolumeClaim claim) {
        return new V1Volume()
                .name(pvcVolumeName(claim))
                .persistentVolumeClaim(new V1PersistentVolumeClaimVolumeSource()
                        .claimName(claim.getMetadata() != null ? claim.getMetadata().getName() : ""));
    }

    /**
     * 선언된 볼륨 경로에 대한 PVC. 이름은 generateName으로 생성되므로 기존 PVC는 라벨로 찾아야 합니다.
     */
    public static V1PersistentVolumeClaim persistentVolumeClaimPayload(AppName appName,
                                                                       DeployableService service,
                                                                       DataSize storageSize,
                                                                       String storageClass,
                                                                       String declaredVolume) {
        return new V1PersistentVolumeClaim()
                .apiVersion("v1")
                .kind("PersistentVolumeClaim")
                .metadata(new V1ObjectMeta()
                        .generateName(appName.toRfc1123NamespaceId() + "-" + service.getServiceName() + "-pvc-")
                        .namespace(appName.toRfc1123NamespaceId())
                        .labels(storageLabels(appName, service.getServiceName(), declaredVolume)))
                .spec(new V1PersistentVolumeClaimSpec()
                        .storageClassName(storageClass)
                        .accessModes(List.of("ReadWriteOnce"))
                        .resources(new V1VolumeResourceRequirements()
                                .requests(Map.of("storage", new Quantity(String.valueOf(storageSize.toBytes()))))));
    }

    /**
     * PVC를 찾을 때 사용하는 라벨. storage-type은 선언된 경로의 마지막 구성 요소입니다.
     */
    public static Map<String, String> storageLabels(AppName appName, String serviceName, String declaredVolume) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(Labels.APP_NAME, appName.getValue());
        labels.put(Labels.SERVICE_NAME, serviceName);
        labels.put(Labels.STORAGE_TYPE, DeployableService.storageType(declaredVolume));
        return labels;
    }

    /**
     * Deployment, Pod, Service selector에 똑같이 쓰는 라벨.
     */
    public static Map<String, String> serviceLabels(AppName appName, ServiceConfig config) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(Labels.APP_NAME, appName.getValue());
        labels.put(Labels.SERVICE_NAME, config.getServiceName());
        labels.put(Labels.CONTAINER_TYPE, config.getContainerType().getLabel());
        return labels;
    }

    public static String labelSelector(Map<String, String> labels) {
        return labels.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(","));
    }

    public static String deploymentName(AppName appName, String serviceName) {
        return appName.toRfc1123NamespaceId() + "-" + serviceName + "-deployment";
    }

    public static String fileSecretName(AppName appName, String serviceName) {
        return appName.toRfc1123NamespaceId() + "-" + serviceName + "-secret";
    }

    public static String imagePullSecretName(AppName appName) {
        return appName.toRfc1123NamespaceId() + "-image-pull-secret";
    }

    public static String ingressRouteName(AppName appName, String serviceName) {
        return appName.toRfc1123NamespaceId() + "-" + serviceName + "-ingress-route";
    }

    private static String pvcVolumeName(V1PersistentVolumeClaim claim) {
        Map<String, String> labels = claim.getMetadata() != null ? claim.getMetadata().getLabels() : null;
        String storageType = labels != null
                ? labels.getOrDefault(Labels.STORAGE_TYPE, DeployableService.DEFAULT_STORAGE_TYPE)
                : DeployableService.DEFAULT_STORAGE_TYPE;
        return storageType + "-volume";
    }

    /**
     * 파일을 상위 디렉터리별로 묶습니다. 같은 디렉터리의 파일은 하나의 볼륨으로 마운트됩니다.
     */
    private static Map<Path, List<Path>> filesByParent(Iterable<Path> paths) {
        Map<Path, List<Path>> grouped = new LinkedHashMap<>();
        for (Path path : paths) {
            Path parent = path.getParent();
            if (parent == null || parent.getNameCount() == 0 || path.getFileName() == null) {
                throw new InternalInvariantException("File path without parent directory: " + path);
            }
            grouped.computeIfAbsent(parent, p -> new ArrayList<>()).add(path);
        }
        return grouped;
    }

    private static String replicatedEnvironmentJson(ServiceConfig config) {
        Map<String, Object> replicated = new LinkedHashMap<>();
        for (EnvironmentVariable variable : config.getEnv()) {
            if (!variable.isReplicate()) {
                continue;
            }
            Map<String, Object> value = new LinkedHashMap<>();
            value.put("value", variable.getValue());
            value.put("templated", variable.isTemplated());
            value.put("replicate", variable.isReplicate());
            replicated.put(variable.getKey(), value);
        }

        try {
            return OBJECT_MAPPER.writeValueAsString(replicated);
        } catch (JsonProcessingException e) {
            throw new InternalInvariantException("Replicated environment 직렬화 실패: " + e.getMessage(), e);
        }
    }

    private static V1ResourceRequirements memoryLimits(DataSize memoryLimit) {
        return new V1ResourceRequirements()
                .limits(Map.of("memory", new Quantity(String.valueOf(memoryLimit.toBytes()))));
    }
}
