package sbhackathon.koala.previewStack.infra.kubernetes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1Deployment;
import io.kubernetes.client.openapi.models.V1Namespace;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaim;
import io.kubernetes.client.openapi.models.V1Secret;
import io.kubernetes.client.openapi.models.V1Service;
import io.kubernetes.client.openapi.models.V1Volume;
import io.kubernetes.client.openapi.models.V1VolumeMount;
import org.junit.jupiter.api.Test;
import org.springframework.util.unit.DataSize;
import sbhackathon.koala.previewStack.config.ContainerConfig;
import sbhackathon.koala.previewStack.config.KubernetesConfig.RegistryCredentials;
import sbhackathon.koala.previewStack.config.RuntimeConfig;
import sbhackathon.koala.previewStack.deployment.DeployableService;
import sbhackathon.koala.previewStack.deployment.DeploymentStrategy;
import sbhackathon.koala.previewStack.entity.AppName;
import sbhackathon.koala.previewStack.entity.ContainerType;
import sbhackathon.koala.previewStack.entity.Environment;
import sbhackathon.koala.previewStack.entity.EnvironmentVariable;
import sbhackathon.koala.previewStack.entity.ServiceConfig;
import sbhackathon.koala.previewStack.exception.InternalInvariantException;
import sbhackathon.koala.previewStack.infra.Labels;
import sbhackathon.koala.previewStack.infra.kubernetes.crd.IngressRoute;
import sbhackathon.koala.previewStack.infra.kubernetes.crd.Middleware;
import sbhackathon.koala.previewStack.infra.traefik.TraefikIngressRoute;
import sbhackathon.koala.previewStack.infra.traefik.TraefikMiddleware;
import sbhackathon.koala.previewStack.infra.traefik.TraefikRoute;
import sbhackathon.koala.previewStack.infra.traefik.TraefikRouterRule;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class KubernetesPayloadsTest {

    private static final AppName MASTER = AppName.MASTER;
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);

    private static DeployableService dbService(DeploymentStrategy strategy) {
        return dbService(MASTER, ServiceConfig.builder()
                .serviceName("db")
                .image("mariadb:10.3.17")
                .port(80)
                .containerType(ContainerType.INSTANCE)
                .build(), strategy, List.of());
    }

    private static DeployableService dbService(AppName appName,
                                               ServiceConfig config,
                                               DeploymentStrategy strategy,
                                               List<String> volumes) {
        return new DeployableService(config, strategy,
                TraefikIngressRoute.withRule(TraefikRouterRule.pathPrefixRule(appName.getValue(), config.getServiceName())),
                volumes);
    }

    @Test
    void deploymentPayload_master_db_예제() {
        // given
        DeployableService service = dbService(DeploymentStrategy.redeployAlways());

        // when
        V1Deployment deployment = KubernetesPayloads.deploymentPayload(
                MASTER, service, new ContainerConfig(), false, Map.of(), CLOCK);

        // then
        assertThat(deployment.getMetadata().getName()).isEqualTo("master-db-deployment");
        assertThat(deployment.getMetadata().getNamespace()).isEqualTo("master");
        assertThat(deployment.getMetadata().getAnnotations()).containsEntry(Labels.IMAGE, "mariadb:10.3.17");
        assertThat(deployment.getMetadata().getLabels()).containsExactly(
                entry(Labels.APP_NAME, "master"),
                entry(Labels.SERVICE_NAME, "db"),
                entry(Labels.CONTAINER_TYPE, "instance"));

        // selector와 Pod 라벨은 Deployment 라벨과 같아야 함
        assertThat(deployment.getSpec().getSelector().getMatchLabels())
                .isEqualTo(deployment.getMetadata().getLabels());
        assertThat(deployment.getSpec().getTemplate().getMetadata().getLabels())
                .isEqualTo(deployment.getMetadata().getLabels());
        assertThat(deployment.getSpec().getReplicas()).isEqualTo(1);

        // redeploy annotation은 Deployment가 아닌 Pod template에 붙어야 함
        assertThat(deployment.getSpec().getTemplate().getMetadata().getAnnotations())
                .containsEntry("date", "2024-05-01T10:15:30Z");
        assertThat(deployment.getMetadata().getAnnotations()).doesNotContainKey("date");

        V1Container container = deployment.getSpec().getTemplate().getSpec().getContainers().get(0);
        assertThat(container.getName()).isEqualTo("db");
        assertThat(container.getImage()).isEqualTo("mariadb:10.3.17");
        assertThat(container.getImagePullPolicy()).isEqualTo("Always");
        assertThat(container.getPorts().get(0).getContainerPort()).isEqualTo(80);
        assertThat(container.getEnv()).isNull();
        assertThat(container.getResources()).isNull();
        assertThat(deployment.getSpec().getTemplate().getSpec().getImagePullSecrets()).isNull();
    }

    @Test
    void ingressRoutePayload_master_db_예제() {
        // given
        DeployableService service = dbService(DeploymentStrategy.redeployAlways());

        // when
        IngressRoute ingressRoute = KubernetesPayloads.ingressRoutePayload(MASTER, service);

        // then
        assertThat(ingressRoute.getApiVersion()).isEqualTo("traefik.containo.us/v1alpha1");
        assertThat(ingressRoute.getKind()).isEqualTo("IngressRoute");
        assertThat(ingressRoute.getMetadata().getName()).isEqualTo("master-db-ingress-route");
        assertThat(ingressRoute.getMetadata().getNamespace()).isEqualTo("master");
        assertThat(ingressRoute.getMetadata().getAnnotations())
                .containsEntry(KubernetesPayloads.ENTRY_POINTS_ANNOTATION, "web")
                .containsEntry(Labels.APP_NAME, "master");

        assertThat(ingressRoute.getSpec().getRoutes()).hasSize(1);
        IngressRoute.Route route = ingressRoute.getSpec().getRoutes().get(0);
        assertThat(route.getKind()).isEqualTo("Rule");
        assertThat(route.getMatch()).isEqualTo("PathPrefix(`/master/db/`)");
        assertThat(route.getServices()).containsExactly(IngressRoute.RouteService.builder()
                .kind("Service")
                .name("db")
                .port(80)
                .build());
        assertThat(ingressRoute.getSpec().getTls()).isNull();
    }

    @Test
    void 대문자_앱_이름은_이름에만_정규화되고_라벨에는_그대로() {
        // given
        AppName appName = AppName.of("MY-APP");
        DeployableService service = dbService(appName,
                ServiceConfig.builder().serviceName("db").image("mariadb:10.3.17").build(),
                DeploymentStrategy.redeployNever(), List.of());

        // when
        V1Namespace namespace = KubernetesPayloads.namespacePayload(appName, new RuntimeConfig());
        V1Deployment deployment = KubernetesPayloads.deploymentPayload(
                appName, service, new ContainerConfig(), true, Map.of(), CLOCK);

        // then
        assertThat(namespace.getMetadata().getName()).isEqualTo("my-app");
        assertThat(namespace.getMetadata().getLabels()).containsEntry(Labels.APP_NAME, "MY-APP");
        assertThat(deployment.getMetadata().getName()).isEqualTo("my-app-db-deployment");
        assertThat(deployment.getMetadata().getNamespace()).isEqualTo("my-app");
        assertThat(deployment.getMetadata().getLabels()).containsEntry(Labels.APP_NAME, "MY-APP");
        assertThat(deployment.getSpec().getTemplate().getSpec().getImagePullSecrets())
                .extracting(reference -> reference.getName())
                .containsExactly("my-app-image-pull-secret");
    }

    @Test
    void namespacePayload_annotation이_없으면_필드_생략() {
        RuntimeConfig runtimeConfig = new RuntimeConfig();

        V1Namespace namespace = KubernetesPayloads.namespacePayload(MASTER, runtimeConfig);

        assertThat(namespace.getMetadata().getAnnotations()).isNull();
    }

    @Test
    void namespacePayload_설정된_annotation_적용() {
        RuntimeConfig runtimeConfig = new RuntimeConfig();
        runtimeConfig.getAnnotations().setNamespace(Map.of("field.cattle.io/projectId", "c-abc:p-xyz"));

        V1Namespace namespace = KubernetesPayloads.namespacePayload(MASTER, runtimeConfig);

        assertThat(namespace.getMetadata().getAnnotations())
                .containsExactly(entry("field.cattle.io/projectId", "c-abc:p-xyz"));
    }

    @Test
    void deploymentPayload_같은_입력이면_같은_결과() {
        Map<Path, String> files = new LinkedHashMap<>();
        files.put(Path.of("/etc/mysql/my.cnf"), "[mysqld]");
        DeployableService service = dbService(MASTER, ServiceConfig.builder()
                        .serviceName("db")
                        .image("mariadb:10.3.17")
                        .env(new Environment(List.of(
                                new EnvironmentVariable("MYSQL_USER", "admin"),
                                EnvironmentVariable.replicated("MYSQL_PASSWORD", "secret"))))
                        .files(files)
                        .build(),
                DeploymentStrategy.redeployOnImageUpdate("sha256:1234"), List.of());
        ContainerConfig containerConfig = new ContainerConfig(DataSize.ofMegabytes(512));

        V1Deployment first = KubernetesPayloads.deploymentPayload(
                MASTER, service, containerConfig, false, Map.of(), Clock.systemUTC());
        V1Deployment second = KubernetesPayloads.deploymentPayload(
                MASTER, service, containerConfig, false, Map.of(), Clock.offset(CLOCK, Duration.ofHours(1)));

        assertThat(first).isEqualTo(second);
        assertThat(first.getSpec().getTemplate().getMetadata().getAnnotations())
                .containsExactly(entry("imageHash", "sha256:1234"));
    }

    @Test
    void deploymentPayload_always_전략은_annotation만_다름() {
        DeployableService service = dbService(DeploymentStrategy.redeployAlways());

        V1Deployment first = KubernetesPayloads.deploymentPayload(
                MASTER, service, new ContainerConfig(), false, Map.of(), CLOCK);
        V1Deployment second = KubernetesPayloads.deploymentPayload(
                MASTER, service, new ContainerConfig(), false, Map.of(), Clock.offset(CLOCK, Duration.ofMinutes(1)));

        assertThat(first).isNotEqualTo(second);

        // date annotation을 지우면 나머지는 같아야 함
        first.getSpec().getTemplate().getMetadata().getAnnotations().remove("date");
        second.getSpec().getTemplate().getMetadata().getAnnotations().remove("date");
        assertThat(first).isEqualTo(second);
    }

    @Test
    void deploymentPayload_같은_디렉토리의_파일은_볼륨_하나로_묶음() {
        // given
        Map<Path, String> files = new LinkedHashMap<>();
        files.put(Path.of("/etc/mysql/my.cnf"), "[mysqld]");
        files.put(Path.of("/etc/mysql/conf.d/extra.cnf"), "[client]");
        files.put(Path.of("/etc/mysql/users.sql"), "CREATE USER");
        DeployableService service = dbService(MASTER, ServiceConfig.builder()
                        .serviceName("db")
                        .image("mariadb:10.3.17")
                        .files(files)
                        .build(),
                DeploymentStrategy.redeployNever(), List.of());

        // when
        V1Deployment deployment = KubernetesPayloads.deploymentPayload(
                MASTER, service, new ContainerConfig(), false, Map.of(), CLOCK);

        // then
        List<V1Volume> volumes = deployment.getSpec().getTemplate().getSpec().getVolumes();
        assertThat(volumes).extracting(V1Volume::getName).containsExactly("etc-mysql-conf-d", "etc-mysql");

        V1Volume mysql = volumes.get(1);
        assertThat(mysql.getSecret().getSecretName()).isEqualTo("master-db-secret");
        assertThat(mysql.getSecret().getItems())
                .extracting(item -> item.getKey() + "=" + item.getPath())
                .containsExactly("my-cnf=my.cnf", "users-sql=users.sql");

        List<V1VolumeMount> mounts = deployment.getSpec().getTemplate().getSpec().getContainers().get(0).getVolumeMounts();
        assertThat(mounts).extracting(V1VolumeMount::getMountPath).containsExactly("/etc/mysql/conf.d", "/etc/mysql");
    }

    @Test
    void deploymentPayload_영구_볼륨은_파일이_없어도_마운트() {
        // given
        DeployableService service = dbService(MASTER,
                ServiceConfig.builder().serviceName("db").image("mariadb:10.3.17").build(),
                DeploymentStrategy.redeployNever(), List.of("/var/lib/mysql"));
        V1PersistentVolumeClaim claim = new V1PersistentVolumeClaim()
                .metadata(new V1ObjectMeta()
                        .name("master-db-pvc-x7k2p")
                        .labels(KubernetesPayloads.storageLabels(MASTER, "db", "/var/lib/mysql")));

        // when
        V1Deployment deployment = KubernetesPayloads.deploymentPayload(
                MASTER, service, new ContainerConfig(), false, Map.of("/var/lib/mysql", claim), CLOCK);

        // then
        V1Volume volume = deployment.getSpec().getTemplate().getSpec().getVolumes().get(0);
        assertThat(volume.getName()).isEqualTo("mysql-volume");
        assertThat(volume.getPersistentVolumeClaim().getClaimName()).isEqualTo("master-db-pvc-x7k2p");

        V1VolumeMount mount = deployment.getSpec().getTemplate().getSpec().getContainers().get(0).getVolumeMounts().get(0);
        assertThat(mount.getName()).isEqualTo("mysql-volume");
        assertThat(mount.getMountPath()).isEqualTo("/var/lib/mysql");
    }

    @Test
    void pvcVolumePayload_storage_type_라벨이_없으면_default() {
        V1PersistentVolumeClaim claim = new V1PersistentVolumeClaim()
                .metadata(new V1ObjectMeta().name("claim"));

        assertThat(KubernetesPayloads.pvcVolumePayload(claim).getName()).isEqualTo("default-volume");
        assertThat(KubernetesPayloads.pvcVolumeMountPayload("/data", claim).getName()).isEqualTo("default-volume");
    }

    @Test
    void deploymentPayload_replicated_환경변수_annotation과_메모리_제한() throws Exception {
        // given
        DeployableService service = dbService(MASTER, ServiceConfig.builder()
                        .serviceName("db")
                        .image("mariadb:10.3.17")
                        .env(new Environment(List.of(
                                new EnvironmentVariable("MYSQL_USER", "admin"),
                                new EnvironmentVariable("MYSQL_PASSWORD", "secret", true, true))))
                        .build(),
                DeploymentStrategy.redeployNever(), List.of());

        // when
        V1Deployment deployment = KubernetesPayloads.deploymentPayload(
                MASTER, service, new ContainerConfig(DataSize.ofMegabytes(256)), false, Map.of(), CLOCK);

        // then
        V1Container container = deployment.getSpec().getTemplate().getSpec().getContainers().get(0);
        assertThat(container.getEnv()).extracting(env -> env.getName() + "=" + env.getValue())
                .containsExactly("MYSQL_USER=admin", "MYSQL_PASSWORD=secret");
        assertThat(container.getResources().getLimits().get("memory").getNumber().longValue())
                .isEqualTo(DataSize.ofMegabytes(256).toBytes());

        JsonNode replicated = new ObjectMapper().readTree(
                deployment.getMetadata().getAnnotations().get(Labels.REPLICATED_ENV));
        assertThat(replicated.has("MYSQL_USER")).isFalse();
        assertThat(replicated.get("MYSQL_PASSWORD").get("value").asText()).isEqualTo("secret");
        assertThat(replicated.get("MYSQL_PASSWORD").get("templated").asBoolean()).isTrue();
        assertThat(replicated.get("MYSQL_PASSWORD").get("replicate").asBoolean()).isTrue();
    }

    @Test
    void deploymentReplicasPayload_replicas_관련_필드만_포함() {
        ServiceConfig config = ServiceConfig.builder().serviceName("db").image("mariadb:10.3.17").build();

        V1Deployment deployment = KubernetesPayloads.deploymentReplicasPayload(MASTER, config, 0);

        assertThat(deployment.getMetadata().getName()).isEqualTo("master-db-deployment");
        assertThat(deployment.getMetadata().getAnnotations()).isNull();
        assertThat(deployment.getSpec().getReplicas()).isZero();
        assertThat(deployment.getSpec().getSelector().getMatchLabels())
                .isEqualTo(KubernetesPayloads.serviceLabels(MASTER, config));
        assertThat(deployment.getSpec().getTemplate()).isNull();

        // apply 페이로드에 빈 annotations가 실리면 그 필드의 소유권까지 가져감
        assertThat(new ApiClient().getJSON().serialize(deployment)).doesNotContain("annotations");
    }

    @Test
    void deploymentPayload_ImagePullSecret을_쓰지_않으면_페이로드에서_생략() {
        V1Deployment deployment = KubernetesPayloads.deploymentPayload(MASTER,
                dbService(DeploymentStrategy.redeployNever()), new ContainerConfig(), false, Map.of(), CLOCK);

        assertThat(new ApiClient().getJSON().serialize(deployment)).doesNotContain("imagePullSecrets");
    }

    @Test
    void deploymentPayload_루트_바로_아래_파일은_예외() {
        DeployableService service = dbService(MASTER, ServiceConfig.builder()
                .serviceName("web")
                .image("nginx:1.25")
                .files(Map.of(Path.of("/app.conf"), "listen 80;"))
                .build(), DeploymentStrategy.redeployNever(), List.of());

        assertThatThrownBy(() -> KubernetesPayloads.deploymentPayload(
                MASTER, service, new ContainerConfig(), false, Map.of(), CLOCK))
                .isInstanceOf(InternalInvariantException.class)
                .hasMessageContaining("/app.conf");
    }

    @Test
    void secretsPayload_파일_이름을_키로_사용() {
        // given
        Map<Path, String> files = new LinkedHashMap<>();
        files.put(Path.of("/etc/mysql/my.cnf"), "[mysqld]");
        ServiceConfig config = ServiceConfig.builder()
                .serviceName("db")
                .image("mariadb:10.3.17")
                .files(files)
                .build();

        // when
        V1Secret secret = KubernetesPayloads.secretsPayload(MASTER, config, config.getFiles());

        // then
        assertThat(secret.getMetadata().getName()).isEqualTo("master-db-secret");
        assertThat(secret.getMetadata().getNamespace()).isEqualTo("master");
        assertThat(secret.getType()).isEqualTo("Opaque");
        assertThat(new String(secret.getData().get("my-cnf"), StandardCharsets.UTF_8)).isEqualTo("[mysqld]");
    }

    @Test
    void imagePullSecretPayload_docker_config_json_형식() throws Exception {
        // when
        V1Secret secret = KubernetesPayloads.imagePullSecretPayload(MASTER,
                Map.of("registry.example.com", new RegistryCredentials("robot", "p4ss")));

        // then
        assertThat(secret.getMetadata().getName()).isEqualTo("master-image-pull-secret");
        assertThat(secret.getImmutable()).isTrue();
        assertThat(secret.getType()).isEqualTo("kubernetes.io/dockerconfigjson");

        JsonNode auth = new ObjectMapper()
                .readTree(secret.getData().get(".dockerconfigjson"))
                .get("auths")
                .get("registry.example.com");
        assertThat(auth.get("username").asText()).isEqualTo("robot");
        assertThat(auth.get("password").asText()).isEqualTo("p4ss");
        assertThat(auth.get("auth").asText()).isEqualTo("cm9ib3Q6cDRzcw==");
    }

    @Test
    void servicePayload_서비스_이름으로_접근() {
        ServiceConfig config = ServiceConfig.builder().serviceName("db").image("mariadb:10.3.17").port(3306).build();

        V1Service service = KubernetesPayloads.servicePayload(MASTER, config);

        assertThat(service.getMetadata().getName()).isEqualTo("db");
        assertThat(service.getMetadata().getNamespace()).isEqualTo("master");
        assertThat(service.getSpec().getPorts().get(0).getName()).isEqualTo("db");
        assertThat(service.getSpec().getPorts().get(0).getPort()).isEqualTo(3306);
        assertThat(service.getSpec().getSelector()).isEqualTo(KubernetesPayloads.serviceLabels(MASTER, config));
    }

    @Test
    void middleware_spec_이름이_앱_이름이면_정규화() {
        // given
        TraefikMiddleware spec = TraefikMiddleware.spec("MY-APP", Map.of("headers", Map.of("customRequestHeaders", Map.of())));
        TraefikMiddleware ref = TraefikMiddleware.ref("Auth@File");
        TraefikIngressRoute route = new TraefikIngressRoute(List.of(), List.of(
                new TraefikRoute(TraefikRouterRule.pathPrefixRule("MY-APP", "db"), List.of(spec, ref), null)));
        AppName appName = AppName.of("MY-APP");
        DeployableService service = new DeployableService(
                ServiceConfig.builder().serviceName("db").image("mariadb:10.3.17").build(),
                DeploymentStrategy.redeployNever(), route, List.of());

        // when
        List<Middleware> middlewares = KubernetesPayloads.middlewarePayloads(appName, service);
        IngressRoute ingressRoute = KubernetesPayloads.ingressRoutePayload(appName, service);

        // then
        assertThat(middlewares).hasSize(1);
        assertThat(middlewares.get(0).getMetadata().getName()).isEqualTo("my-app");
        assertThat(middlewares.get(0).getMetadata().getNamespace()).isEqualTo("my-app");
        assertThat(middlewares.get(0).getSpec()).containsKey("headers");
        assertThat(ingressRoute.getSpec().getRoutes().get(0).getMiddlewares())
                .extracting(IngressRoute.MiddlewareRef::getName)
                .containsExactly("my-app", "Auth@File");
    }

    @Test
    void middlewarePayloads_같은_spec은_한번만_생성() {
        TraefikIngressRoute defaults = TraefikIngressRoute.withDefaults(MASTER, "db");
        TraefikRoute route = defaults.getRoutes().get(0);
        DeployableService service = new DeployableService(
                ServiceConfig.builder().serviceName("db").image("mariadb:10.3.17").build(),
                DeploymentStrategy.redeployNever(),
                new TraefikIngressRoute(List.of(), List.of(route, route)),
                List.of());

        List<Middleware> middlewares = KubernetesPayloads.middlewarePayloads(MASTER, service);

        assertThat(middlewares).extracting(middleware -> middleware.getMetadata().getName())
                .containsExactly("master-db-middleware");
        assertThat(middlewares.get(0).getSpec())
                .isEqualTo(Map.of("stripPrefix", Map.of("prefixes", List.of("/master/db/"))));
    }

    @Test
    void ingressRoutePayload_route가_없으면_예외() {
        DeployableService service = new DeployableService(
                ServiceConfig.builder().serviceName("db").image("mariadb:10.3.17").build(),
                DeploymentStrategy.redeployNever(),
                new TraefikIngressRoute(List.of(), List.of()),
                List.of());

        assertThatThrownBy(() -> KubernetesPayloads.ingressRoutePayload(MASTER, service))
                .isInstanceOf(InternalInvariantException.class);
    }

    @Test
    void ingressRoutePayload_cert_resolver가_있으면_tls_설정() {
        TraefikIngressRoute route = TraefikIngressRoute.withExistingRoutingRules(
                List.of("websecure"), TraefikRouterRule.hostRule("preview.example.com"), List.of(), "letsencrypt");
        DeployableService service = new DeployableService(
                ServiceConfig.builder().serviceName("db").image("mariadb:10.3.17").build(),
                DeploymentStrategy.redeployNever(), route, List.of());

        IngressRoute ingressRoute = KubernetesPayloads.ingressRoutePayload(MASTER, service);

        assertThat(ingressRoute.getSpec().getEntryPoints()).containsExactly("websecure");
        assertThat(ingressRoute.getSpec().getTls().getCertResolver()).isEqualTo("letsencrypt");
    }

    @Test
    void persistentVolumeClaimPayload_generateName과_storage_라벨() {
        DeployableService service = dbService(DeploymentStrategy.redeployNever());

        V1PersistentVolumeClaim claim = KubernetesPayloads.persistentVolumeClaimPayload(
                MASTER, service, DataSize.ofGigabytes(2), "local-path", "/var/lib/mysql");

        assertThat(claim.getMetadata().getName()).isNull();
        assertThat(claim.getMetadata().getGenerateName()).isEqualTo("master-db-pvc-");
        assertThat(claim.getMetadata().getLabels()).containsEntry(Labels.STORAGE_TYPE, "mysql");
        assertThat(claim.getSpec().getAccessModes()).containsExactly("ReadWriteOnce");
        assertThat(claim.getSpec().getStorageClassName()).isEqualTo("local-path");
        assertThat(claim.getSpec().getResources().getRequests().get("storage").getNumber().longValue())
                .isEqualTo(DataSize.ofGigabytes(2).toBytes());
    }
}
