package sbhackathon.koala.previewStack;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PreviewStackApplication {

    public static void main(String[] args) {
        SpringApplication.run(PreviewStackApplication.class, args);
    }
}
