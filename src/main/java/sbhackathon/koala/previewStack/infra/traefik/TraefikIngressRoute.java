package sbhackathon.koala.previewStack.infra.traefik;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import sbhackathon.koala.previewStack.entity.AppName;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 하나의 서비스로 들어오는 Traefik 라우팅 설정 (entry point와 route 목록).
 */
@Getter
@EqualsAndHashCode
@ToString
public class TraefikIngressRoute {

    private final List<String> entryPoints;
    private final List<TraefikRoute> routes;

    public TraefikIngressRoute(List<String> entryPoints, List<TraefikRoute> routes) {
        this.entryPoints = List.copyOf(entryPoints);
        this.routes = List.copyOf(routes);
    }

    public static TraefikIngressRoute withRule(TraefikRouterRule rule) {
        return new TraefikIngressRoute(List.of(), List.of(new TraefikRoute(rule)));
    }

    /**
     * {@code /{app}/{service}/} 경로로 서비스를 노출하고, 서비스에 요청이 전달되기 전에
     * 해당 prefix를 제거하는 기본 route를 만듭니다.
     */
    public static TraefikIngressRoute withDefaults(AppName appName, String serviceName) {
        TraefikRouterRule rule = TraefikRouterRule.pathPrefixRule(appName.getValue(), serviceName);
        Map<String, Object> stripPrefix = Map.of(
                "stripPrefix", Map.of("prefixes", rule.pathPrefixes()));

        TraefikMiddleware middleware = TraefikMiddleware.spec(
                appName.getValue() + "-" + serviceName + "-middleware", stripPrefix);
        return new TraefikIngressRoute(List.of(), List.of(new TraefikRoute(rule, List.of(middleware), null)));
    }

    /**
     * 클러스터에 이미 존재하는 라우팅 규칙으로부터 route를 만듭니다. middleware는 모두 참조로 취급합니다.
     */
    public static TraefikIngressRoute withExistingRoutingRules(List<String> entryPoints,
                                                               TraefikRouterRule rule,
                                                               List<String> middlewares,
                                                               String certResolver) {
        List<TraefikMiddleware> refs = middlewares.stream()
                .map(TraefikMiddleware::ref)
                .collect(Collectors.toList());
        return new TraefikIngressRoute(entryPoints, List.of(new TraefikRoute(rule, refs, certResolver)));
    }

    public boolean isEmpty() {
        return routes.isEmpty();
    }

    /**
     * base route(예: 이 시스템의 API로 들어오는 route)의 규칙을 모든 route 앞에 결합합니다.
     * base route가 비어 있으면 그대로 반환합니다.
     */
    public TraefikIngressRoute merge(TraefikIngressRoute base) {
        if (base.isEmpty()) {
            return this;
        }

        TraefikRoute baseRoute = base.routes.get(0);
        List<TraefikRoute> merged = routes.stream()
                .map(route -> route.mergeWith(baseRoute))
                .collect(Collectors.toList());
        List<String> mergedEntryPoints = entryPoints.isEmpty() ? base.entryPoints : entryPoints;
        return new TraefikIngressRoute(mergedEntryPoints, merged);
    }
}
