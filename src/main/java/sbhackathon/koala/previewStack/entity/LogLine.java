package sbhackathon.koala.previewStack.entity;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.OffsetDateTime;

@Getter
@EqualsAndHashCode
@ToString
public class LogLine {

    private final OffsetDateTime timestamp;
    private final String line;

    public LogLine(OffsetDateTime timestamp, String line) {
        this.timestamp = timestamp;
        this.line = line;
    }
}
