package sbhackathon.koala.previewStack.infra.kubernetes;

import java.nio.file.Path;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * 파일 경로로부터 Secret 키와 볼륨 이름을 만듭니다. 두 함수 모두 {@code .}을 {@code -}로 바꿉니다.
 */
public final class SecretNames {

    private SecretNames() {
    }

    /**
     * 경로의 모든 구성 요소를 {@code -}로 이어 붙입니다. 예: {@code /etc/mysql} -> {@code etc-mysql}
     */
    public static String fromPath(Path path) {
        return StreamSupport.stream(path.spliterator(), false)
                .map(Path::toString)
                .filter(component -> !component.isEmpty() && !component.equals(".") && !component.equals(".."))
                .map(SecretNames::replaceDots)
                .collect(Collectors.joining("-"));
    }

    /**
     * 파일 이름만 사용합니다. 예: {@code /etc/mysql/my.cnf} -> {@code my-cnf}
     */
    public static String fromFileName(Path path) {
        Path fileName = path.getFileName();
        return fileName == null ? "" : replaceDots(fileName.toString());
    }

    private static String replaceDots(String value) {
        return value.replace('.', '-');
    }
}
