package sbhackathon.koala.previewStack.infra.kubernetes.crd;

import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Traefik {@code IngressRoute} custom resource.
 *
 * @see <a href="https://doc.traefik.io/traefik/routing/providers/kubernetes-crd/">Traefik Kubernetes CRD</a>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngressRoute implements KubernetesObject {

    public static final String GROUP = "traefik.containo.us";
    public static final String VERSION = "v1alpha1";
    public static final String KIND = "IngressRoute";
    public static final String PLURAL = "ingressroutes";

    @Builder.Default
    private String apiVersion = GROUP + "/" + VERSION;
    @Builder.Default
    private String kind = KIND;
    private V1ObjectMeta metadata;
    private Spec spec;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Spec {
        private List<String> entryPoints;
        private List<Route> routes;
        private Tls tls;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Route {
        private String kind;
        private String match;
        private List<RouteService> services;
        private List<MiddlewareRef> middlewares;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RouteService {
        private String kind;
        private String name;
        private Integer port;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MiddlewareRef {
        private String name;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Tls {
        private String certResolver;
    }
}
