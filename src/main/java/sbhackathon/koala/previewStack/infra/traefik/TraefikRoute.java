package sbhackathon.koala.previewStack.infra.traefik;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Getter
@EqualsAndHashCode
@ToString
public class TraefikRoute {

    private final TraefikRouterRule rule;
    private final List<TraefikMiddleware> middlewares;
    private final String certResolver;

    public TraefikRoute(TraefikRouterRule rule, List<TraefikMiddleware> middlewares, String certResolver) {
        this.rule = rule;
        this.middlewares = List.copyOf(middlewares);
        this.certResolver = certResolver;
    }

    public TraefikRoute(TraefikRouterRule rule) {
        this(rule, List.of(), null);
    }

    public Optional<String> certResolver() {
        return Optional.ofNullable(certResolver);
    }

    /**
     * base route의 규칙과 middleware를 이 route 앞에 붙입니다.
     */
    TraefikRoute mergeWith(TraefikRoute base) {
        List<TraefikMiddleware> merged = new ArrayList<>(base.middlewares);
        for (TraefikMiddleware middleware : middlewares) {
            if (!merged.contains(middleware)) {
                merged.add(middleware);
            }
        }
        String resolver = certResolver != null ? certResolver : base.certResolver;
        return new TraefikRoute(base.rule.merge(rule), merged, resolver);
    }
}
