package sbhackathon.koala.previewStack.infra.traefik;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Traefik middleware 참조. 이미 존재하는 middleware를 이름으로 가리키는 {@link Ref}와
 * 별도의 Middleware 오브젝트로 생성되어야 하는 {@link Spec} 두 가지가 있습니다.
 */
public abstract class TraefikMiddleware {

    private final String name;

    private TraefikMiddleware(String name) {
        this.name = Objects.requireNonNull(name, "middleware name");
    }

    public static Ref ref(String name) {
        return new Ref(name);
    }

    public static Spec spec(String name, Map<String, Object> spec) {
        return new Spec(name, spec);
    }

    public String getName() {
        return name;
    }

    public static final class Ref extends TraefikMiddleware {

        private Ref(String name) {
            super(name);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Ref && getName().equals(((Ref) o).getName());
        }

        @Override
        public int hashCode() {
            return Objects.hash("ref", getName());
        }

        @Override
        public String toString() {
            return "Ref(" + getName() + ")";
        }
    }

    public static final class Spec extends TraefikMiddleware {

        // Traefik Middleware CRD의 spec을 그대로 담습니다 (예: {"stripPrefix": {"prefixes": [...]}})
        private final Map<String, Object> spec;

        private Spec(String name, Map<String, Object> spec) {
            super(name);
            this.spec = Collections.unmodifiableMap(new LinkedHashMap<>(spec));
        }

        public Map<String, Object> getSpec() {
            return spec;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Spec)) {
                return false;
            }
            Spec that = (Spec) o;
            return getName().equals(that.getName()) && spec.equals(that.spec);
        }

        @Override
        public int hashCode() {
            return Objects.hash("spec", getName(), spec);
        }

        @Override
        public String toString() {
            return "Spec(" + getName() + ", " + spec + ")";
        }
    }
}
