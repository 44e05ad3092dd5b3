package sbhackathon.koala.previewStack.infra.kubernetes.crd;

import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Traefik {@code Middleware} custom resource. spec 내용은 해석하지 않고 그대로 전달합니다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Middleware implements KubernetesObject {

    public static final String KIND = "Middleware";
    public static final String PLURAL = "middlewares";

    @Builder.Default
    private String apiVersion = IngressRoute.GROUP + "/" + IngressRoute.VERSION;
    @Builder.Default
    private String kind = KIND;
    private V1ObjectMeta metadata;
    private Map<String, Object> spec;
}
