package sbhackathon.koala.previewStack.entity;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * 배포할 서비스 하나의 설정 (이미지, 포트, 환경 변수, 마운트할 파일).
 */
@Getter
@EqualsAndHashCode
@ToString(exclude = "files")
public class ServiceConfig {

    public static final int DEFAULT_PORT = 80;

    private final String serviceName;
    private final String image;
    private final int port;
    private final ContainerType containerType;
    private final Environment env;
    // 절대 경로 -> 파일 내용. 경로 순으로 정렬해 두어야 페이로드가 항상 같은 순서로 생성됩니다.
    private final Map<Path, String> files;

    @Builder(toBuilder = true)
    public ServiceConfig(String serviceName,
                         String image,
                         Integer port,
                         ContainerType containerType,
                         Environment env,
                         Map<Path, String> files) {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName is required");
        }
        if (image == null || image.isBlank()) {
            throw new IllegalArgumentException("image is required for service " + serviceName);
        }
        this.serviceName = serviceName;
        this.image = image;
        this.port = port != null ? port : DEFAULT_PORT;
        this.containerType = containerType != null ? containerType : ContainerType.INSTANCE;
        this.env = env != null ? env : Environment.empty();
        this.files = files != null
                ? Collections.unmodifiableMap(new TreeMap<>(files))
                : Collections.emptyMap();
    }

    public boolean hasFiles() {
        return !files.isEmpty();
    }
}
