package sbhackathon.koala.previewStack.infra.kubernetes;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class SecretNamesTest {

    @Test
    void fromPath_경로_구성요소를_연결() {
        assertThat(SecretNames.fromPath(Path.of("/etc/mysql"))).isEqualTo("etc-mysql");
        assertThat(SecretNames.fromPath(Path.of("/etc/mysql/conf.d"))).isEqualTo("etc-mysql-conf-d");
    }

    @Test
    void fromFileName_파일_이름의_점을_대시로() {
        assertThat(SecretNames.fromFileName(Path.of("/etc/mysql/my.cnf"))).isEqualTo("my-cnf");
        assertThat(SecretNames.fromFileName(Path.of("/app/config.prod.yml"))).isEqualTo("config-prod-yml");
    }
}
