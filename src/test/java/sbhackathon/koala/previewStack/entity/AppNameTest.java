package sbhackathon.koala.previewStack.entity;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AppNameTest {

    @Test
    void toRfc1123NamespaceId_소문자로_변환() {
        // given
        AppName appName = AppName.of("MY-APP");

        // when
        String namespace = appName.toRfc1123NamespaceId();

        // then
        assertThat(namespace).isEqualTo("my-app");
        assertThat(appName.getValue()).isEqualTo("MY-APP");
    }

    @Test
    void normalize_여러번_적용해도_결과가_같음() {
        String once = AppName.normalize("Feature_Branch.1");
        String twice = AppName.normalize(once);

        assertThat(once).isEqualTo("feature_branch.1");
        assertThat(twice).isEqualTo(once);
    }

    @Test
    void of_허용되지_않는_문자는_거부() {
        assertThatThrownBy(() -> AppName.of("my app"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AppName.of(""))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AppName.of("app/1"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void isValid_null과_공백은_false() {
        assertThat(AppName.isValid(null)).isFalse();
        assertThat(AppName.isValid("  ")).isFalse();
        assertThat(AppName.isValid("master")).isTrue();
    }

    @Test
    void master_기본_애플리케이션() {
        assertThat(AppName.MASTER).isEqualTo(AppName.of("master"));
        assertThat(AppName.MASTER.toRfc1123NamespaceId()).isEqualTo("master");
    }
}
