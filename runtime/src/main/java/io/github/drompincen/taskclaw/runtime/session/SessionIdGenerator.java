package io.github.drompincen.taskclaw.runtime.session;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;

/**
 * Ids of the form {@code session_YYYYMMDD_HHMMSS_<6 hex>}, timestamped in UTC.
 */
@Component
public class SessionIdGenerator {

    private static final DateTimeFormatter STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public SessionIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String next() {
        byte[] suffix = new byte[3];
        random.nextBytes(suffix);
        return "session_" + STAMP.format(clock.instant()) + "_" + HexFormat.of().formatHex(suffix);
    }
}
