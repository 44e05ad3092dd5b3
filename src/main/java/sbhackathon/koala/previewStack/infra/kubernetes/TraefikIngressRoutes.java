package sbhackathon.koala.previewStack.infra.kubernetes;

import sbhackathon.koala.previewStack.exception.TraefikRuleParseException;
import sbhackathon.koala.previewStack.infra.kubernetes.crd.IngressRoute;
import sbhackathon.koala.previewStack.infra.traefik.TraefikIngressRoute;
import sbhackathon.koala.previewStack.infra.traefik.TraefikMiddleware;
import sbhackathon.koala.previewStack.infra.traefik.TraefikRoute;
import sbhackathon.koala.previewStack.infra.traefik.TraefikRouterRule;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 클러스터에 저장된 IngressRoute를 내부 라우팅 모델로 되돌립니다.
 */
public final class TraefikIngressRoutes {

    private TraefikIngressRoutes() {
    }

    /**
     * middleware는 모두 이름 참조({@link TraefikMiddleware.Ref})가 되고, TLS cert resolver는 그대로 복사됩니다.
     *
     * @throws TraefikRuleParseException route가 없거나 match 규칙을 해석할 수 없는 경우
     */
    public static TraefikIngressRoute fromIngressRoute(IngressRoute ingressRoute) throws TraefikRuleParseException {
        String name = ingressRoute.getMetadata() != null ? ingressRoute.getMetadata().getName() : null;
        IngressRoute.Spec spec = ingressRoute.getSpec();
        if (spec == null || spec.getRoutes() == null || spec.getRoutes().isEmpty()) {
            throw new TraefikRuleParseException("IngressRoute " + name + " does not declare any route");
        }

        String certResolver = spec.getTls() != null ? spec.getTls().getCertResolver() : null;

        List<TraefikRoute> routes = new ArrayList<>();
        for (IngressRoute.Route route : spec.getRoutes()) {
            TraefikRouterRule rule = TraefikRouterRule.parse(route.getMatch());
            List<TraefikMiddleware> middlewares = route.getMiddlewares() == null
                    ? List.of()
                    : route.getMiddlewares().stream()
                    .map(middleware -> TraefikMiddleware.ref(middleware.getName()))
                    .collect(Collectors.toList());
            routes.add(new TraefikRoute(rule, middlewares, certResolver));
        }

        List<String> entryPoints = spec.getEntryPoints() != null ? spec.getEntryPoints() : List.of();
        return new TraefikIngressRoute(entryPoints, routes);
    }
}
