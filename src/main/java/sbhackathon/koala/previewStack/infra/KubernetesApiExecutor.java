package sbhackathon.koala.previewStack.infra;

import io.kubernetes.client.common.KubernetesListObject;
import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.common.KubernetesType;
import io.kubernetes.client.custom.V1Patch;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.openapi.models.V1Deployment;
import io.kubernetes.client.openapi.models.V1DeploymentList;
import io.kubernetes.client.openapi.models.V1Namespace;
import io.kubernetes.client.openapi.models.V1NamespaceList;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaim;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaimList;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1PodList;
import io.kubernetes.client.openapi.models.V1Secret;
import io.kubernetes.client.openapi.models.V1SecretList;
import io.kubernetes.client.openapi.models.V1Service;
import io.kubernetes.client.openapi.models.V1ServiceList;
import io.kubernetes.client.util.generic.GenericKubernetesApi;
import io.kubernetes.client.util.generic.KubernetesApiResponse;
import io.kubernetes.client.util.generic.options.ListOptions;
import io.kubernetes.client.util.generic.options.PatchOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import sbhackathon.koala.previewStack.config.KubernetesConfig;
import sbhackathon.koala.previewStack.exception.InfrastructureException;
import sbhackathon.koala.previewStack.infra.kubernetes.crd.IngressRoute;
import sbhackathon.koala.previewStack.infra.kubernetes.crd.IngressRouteList;
import sbhackathon.koala.previewStack.infra.kubernetes.crd.Middleware;
import sbhackathon.koala.previewStack.infra.kubernetes.crd.MiddlewareList;

import java.net.HttpURLConnection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Kubernetes API 호출을 담당합니다. 모든 변경은 server-side apply로 적용하므로
 * 같은 페이로드를 여러 번 적용해도 결과가 같습니다.
 */
@Component
@ConditionalOnProperty(prefix = "runtime", name = "type", havingValue = "KUBERNETES", matchIfMissing = true)
public class KubernetesApiExecutor {

    private static final Logger logger = LoggerFactory.getLogger(KubernetesApiExecutor.class);

    /**
     * replicas만 적용할 때 쓰는 field manager 접미사.
     * 전체 Deployment를 적용한 field manager와 분리해야 나머지 필드의 소유권이 유지됩니다.
     */
    public static final String SCALE_FIELD_MANAGER_SUFFIX = "-scale";

    private final ApiClient apiClient;
    private final KubernetesConfig kubernetesConfig;
    private final Map<Class<?>, ResourceApi<?, ?>> apis = new HashMap<>();

    public KubernetesApiExecutor(ApiClient apiClient, KubernetesConfig kubernetesConfig) {
        this.apiClient = apiClient;
        this.kubernetesConfig = kubernetesConfig;

        register(V1Namespace.class, V1NamespaceList.class, "", "v1", "namespaces", false);
        register(V1Deployment.class, V1DeploymentList.class, "apps", "v1", "deployments", true);
        register(V1Service.class, V1ServiceList.class, "", "v1", "services", true);
        register(V1Secret.class, V1SecretList.class, "", "v1", "secrets", true);
        register(V1Pod.class, V1PodList.class, "", "v1", "pods", true);
        register(V1PersistentVolumeClaim.class, V1PersistentVolumeClaimList.class,
                "", "v1", "persistentvolumeclaims", true);
        register(IngressRoute.class, IngressRouteList.class,
                IngressRoute.GROUP, IngressRoute.VERSION, IngressRoute.PLURAL, true);
        register(Middleware.class, MiddlewareList.class,
                IngressRoute.GROUP, IngressRoute.VERSION, Middleware.PLURAL, true);
    }

    private <T extends KubernetesObject, L extends KubernetesListObject> void register(
            Class<T> type, Class<L> listType, String group, String version, String plural, boolean namespaced) {
        register(type, new GenericKubernetesApi<>(type, listType, group, version, plural, apiClient), namespaced);
    }

    <T extends KubernetesObject, L extends KubernetesListObject> void register(
            Class<T> type, GenericKubernetesApi<T, L> api, boolean namespaced) {
        apis.put(type, new ResourceApi<>(type, api, namespaced));
    }

    /**
     * 오브젝트를 server-side apply로 생성하거나 갱신합니다.
     *
     * @return API 서버가 반환한 최신 메타데이터
     * @throws InfrastructureException API 호출 실패 시
     */
    public V1ObjectMeta apply(KubernetesObject object) {
        return apply(object, kubernetesConfig.getFieldManager());
    }

    /**
     * Deployment의 replicas만 별도 field manager로 적용합니다.
     * 같은 field manager로 replicas만 담긴 페이로드를 적용하면 그 manager가 소유하던 Pod 템플릿이 제거됩니다.
     */
    public V1ObjectMeta applyScale(V1Deployment deployment) {
        return apply(deployment, kubernetesConfig.getFieldManager() + SCALE_FIELD_MANAGER_SUFFIX);
    }

    private V1ObjectMeta apply(KubernetesObject object, String fieldManager) {
        String name = object.getMetadata().getName();
        String namespace = object.getMetadata().getNamespace();
        String description = describe(object.getKind(), namespace, name);

        logger.info("Kubernetes apply 실행 ({}): {}", fieldManager, description);
        V1Patch patch = new V1Patch(apiClient.getJSON().serialize(object));
        logger.debug("적용할 페이로드:\n{}", patch.getValue());

        PatchOptions options = new PatchOptions();
        options.setFieldManager(fieldManager);
        options.setForce(true);

        KubernetesObject applied = patch(resourceApi(object.getClass()), namespace, name, patch, options, description);
        return applied != null ? applied.getMetadata() : null;
    }

    private <T extends KubernetesObject, L extends KubernetesListObject> T patch(ResourceApi<T, L> resource,
                                                                                String namespace,
                                                                                String name,
                                                                                V1Patch patch,
                                                                                PatchOptions options,
                                                                                String description) {
        KubernetesApiResponse<T> response = call(description, () -> resource.namespaced
                ? resource.api.patch(namespace, name, V1Patch.PATCH_FORMAT_APPLY_YAML, patch, options)
                : resource.api.patch(name, V1Patch.PATCH_FORMAT_APPLY_YAML, patch, options));
        return unwrap(response, "apply " + description);
    }

    /**
     * 새 오브젝트를 생성합니다. {@code generateName}을 쓰는 오브젝트에 사용합니다.
     *
     * @return API 서버가 이름을 붙인 메타데이터
     */
    public V1ObjectMeta create(KubernetesObject object) {
        String description = describe(object.getKind(), object.getMetadata().getNamespace(),
                object.getMetadata().getName() != null
                        ? object.getMetadata().getName()
                        : object.getMetadata().getGenerateName() + "*");

        logger.info("Kubernetes create 실행: {}", description);
        KubernetesObject created = create(resourceApi(object.getClass()), object, description);
        return created != null ? created.getMetadata() : null;
    }

    private <T extends KubernetesObject, L extends KubernetesListObject> T create(ResourceApi<T, L> resource,
                                                                                 KubernetesObject object,
                                                                                 String description) {
        T typed = resource.type.cast(object);
        return unwrap(call(description, () -> resource.api.create(typed)), "create " + description);
    }

    /**
     * 오브젝트를 조회합니다. 존재하지 않으면 {@link Optional#empty()}.
     */
    public <T extends KubernetesObject> Optional<T> get(Class<T> type, String namespace, String name) {
        String description = describe(type.getSimpleName(), namespace, name);
        return Optional.ofNullable(get(resourceApi(type), namespace, name, description)).map(type::cast);
    }

    private <T extends KubernetesObject, L extends KubernetesListObject> T get(ResourceApi<T, L> resource,
                                                                              String namespace,
                                                                              String name,
                                                                              String description) {
        KubernetesApiResponse<T> response = call(description, () -> resource.namespaced
                ? resource.api.get(namespace, name)
                : resource.api.get(name));
        if (response.getHttpStatusCode() == HttpURLConnection.HTTP_NOT_FOUND) {
            return null;
        }
        return unwrap(response, "get " + description);
    }

    /**
     * 라벨 셀렉터로 오브젝트 목록을 조회합니다.
     *
     * @param namespace null이면 모든 네임스페이스
     */
    public <T extends KubernetesObject> List<T> list(Class<T> type, String namespace, String labelSelector) {
        String description = describe(type.getSimpleName(), namespace, labelSelector);

        ListOptions options = new ListOptions();
        options.setLabelSelector(labelSelector);

        KubernetesListObject list = list(resourceApi(type), namespace, options, description);
        if (list == null || list.getItems() == null) {
            return List.of();
        }
        return list.getItems().stream()
                .map(type::cast)
                .collect(Collectors.toList());
    }

    private <T extends KubernetesObject, L extends KubernetesListObject> L list(ResourceApi<T, L> resource,
                                                                               String namespace,
                                                                               ListOptions options,
                                                                               String description) {
        KubernetesApiResponse<L> response = call(description, () -> namespace != null
                ? resource.api.list(namespace, options)
                : resource.api.list(options));
        return unwrap(response, "list " + description);
    }

    public void delete(Class<? extends KubernetesObject> type, String namespace, String name) {
        String description = describe(type.getSimpleName(), namespace, name);

        logger.info("Kubernetes delete 실행: {}", description);
        delete(resourceApi(type), namespace, name, description);
    }

    private <T extends KubernetesObject, L extends KubernetesListObject> void delete(ResourceApi<T, L> resource,
                                                                                    String namespace,
                                                                                    String name,
                                                                                    String description) {
        KubernetesApiResponse<T> response = call(description, () -> resource.namespaced
                ? resource.api.delete(namespace, name)
                : resource.api.delete(name));
        if (response.getHttpStatusCode() == HttpURLConnection.HTTP_NOT_FOUND) {
            logger.info("삭제할 오브젝트가 이미 없습니다: {}", description);
            return;
        }
        unwrap(response, "delete " + description);
    }

    /**
     * Pod 로그를 타임스탬프와 함께 읽습니다.
     * Pod가 없거나 컨테이너가 아직 시작되지 않았으면 {@link Optional#empty()}.
     *
     * @param sinceSeconds null이면 처음부터
     */
    public Optional<String> readPodLog(String namespace, String podName, Integer sinceSeconds) {
        CoreV1Api coreApi = new CoreV1Api(apiClient);
        try {
            String log = coreApi.readNamespacedPodLog(podName, namespace)
                    .timestamps(true)
                    .sinceSeconds(sinceSeconds)
                    .execute();
            return Optional.ofNullable(log);
        } catch (ApiException e) {
            if (e.getCode() == HttpURLConnection.HTTP_NOT_FOUND || e.getCode() == HttpURLConnection.HTTP_BAD_REQUEST) {
                logger.debug("Pod 로그를 읽을 수 없습니다 ({}/{}): {}", namespace, podName, e.getMessage());
                return Optional.empty();
            }
            String errorMessage = String.format("Pod '%s/%s' 로그 조회 실패 (code: %d): %s",
                    namespace, podName, e.getCode(), e.getResponseBody());
            logger.error(errorMessage, e);
            throw new InfrastructureException(errorMessage, e.getCode(), e);
        }
    }

    private <R> R call(String description, ApiCall<R> apiCall) {
        try {
            return apiCall.execute();
        } catch (RuntimeException e) {
            // GenericKubernetesApi는 IO 오류를 RuntimeException으로 감싸서 던집니다
            String errorMessage = "Kubernetes API 호출 중 오류 발생 (" + description + "): " + e.getMessage();
            logger.error(errorMessage, e);
            throw new InfrastructureException(errorMessage, e);
        }
    }

    private <R extends KubernetesType> R unwrap(KubernetesApiResponse<R> response, String action) {
        if (!response.isSuccess()) {
            String reason = response.getStatus() != null ? response.getStatus().getMessage() : "unknown";
            String errorMessage = String.format("Kubernetes %s 실패 (code: %d): %s",
                    action, response.getHttpStatusCode(), reason);
            logger.error(errorMessage);
            throw new InfrastructureException(errorMessage, response.getHttpStatusCode(), null);
        }
        return response.getObject();
    }

    private ResourceApi<?, ?> resourceApi(Class<?> type) {
        ResourceApi<?, ?> resource = apis.get(type);
        if (resource == null) {
            throw new IllegalArgumentException("Unsupported resource type: " + type.getName());
        }
        return resource;
    }

    private static String describe(String kind, String namespace, String name) {
        return namespace != null ? kind + " " + namespace + "/" + name : kind + " " + name;
    }

    @FunctionalInterface
    private interface ApiCall<R> {
        R execute();
    }

    private static final class ResourceApi<T extends KubernetesObject, L extends KubernetesListObject> {
        private final Class<T> type;
        private final GenericKubernetesApi<T, L> api;
        private final boolean namespaced;

        ResourceApi(Class<T> type, GenericKubernetesApi<T, L> api, boolean namespaced) {
            this.type = type;
            this.api = api;
            this.namespaced = namespaced;
        }
    }
}
