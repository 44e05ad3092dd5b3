package sbhackathon.koala.previewStack.deployment;

import lombok.Getter;
import lombok.ToString;
import sbhackathon.koala.previewStack.entity.ContainerType;
import sbhackathon.koala.previewStack.entity.Environment;
import sbhackathon.koala.previewStack.entity.ServiceConfig;
import sbhackathon.koala.previewStack.infra.traefik.TraefikIngressRoute;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 배포 단위 안의 서비스 하나. 서비스 설정에 재배포 전략, 라우팅 규칙, 영구 볼륨 경로를 더한 것입니다.
 */
@Getter
@ToString
public class DeployableService {

    public static final String DEFAULT_STORAGE_TYPE = "default";

    private final ServiceConfig config;
    private final DeploymentStrategy strategy;
    private final TraefikIngressRoute ingressRoute;
    private final List<String> declaredVolumes;

    public DeployableService(ServiceConfig config,
                             DeploymentStrategy strategy,
                             TraefikIngressRoute ingressRoute,
                             List<String> declaredVolumes) {
        this.config = config;
        this.strategy = strategy;
        this.ingressRoute = ingressRoute;
        this.declaredVolumes = List.copyOf(declaredVolumes);

        Map<String, String> volumesByStorageType = new HashMap<>();
        for (String declaredVolume : this.declaredVolumes) {
            String previous = volumesByStorageType.putIfAbsent(storageType(declaredVolume), declaredVolume);
            if (previous != null) {
                throw new IllegalArgumentException(String.format(
                        "Volumes '%s' and '%s' of service '%s' share storage type '%s'",
                        previous, declaredVolume, config.getServiceName(), storageType(declaredVolume)));
            }
        }
    }

    /**
     * 볼륨 경로의 마지막 디렉터리 이름. PVC 라벨과 볼륨 이름에 쓰이므로 서비스 안에서 겹치면 안 됩니다.
     */
    public static String storageType(String declaredVolume) {
        String[] segments = declaredVolume.split("/");
        if (segments.length == 0 || segments[segments.length - 1].isEmpty()) {
            return DEFAULT_STORAGE_TYPE;
        }
        return segments[segments.length - 1];
    }

    public String getServiceName() {
        return config.getServiceName();
    }

    public String getImage() {
        return config.getImage();
    }

    public int getPort() {
        return config.getPort();
    }

    public ContainerType getContainerType() {
        return config.getContainerType();
    }

    public Environment getEnv() {
        return config.getEnv();
    }

    public Map<Path, String> getFiles() {
        return config.getFiles();
    }
}
