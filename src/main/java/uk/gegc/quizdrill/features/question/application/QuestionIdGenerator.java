package uk.gegc.quizdrill.features.question.application;

import org.springframework.stereotype.Component;
import uk.gegc.quizdrill.features.question.config.QuestionProperties;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.UUID;

/**
 * Derives ids for questions imported without one. The id is a name-based UUID (version 5)
 * of a fixed discriminator inside a namespace that is itself the version 5 UUID of the
 * question text, so the same text always maps to the same id.
 */
@Component
public class QuestionIdGenerator {

    static final UUID DNS_NAMESPACE = UUID.fromString("6ba7b810-9dad-11d1-80b4-00c04fd430c8");

    private final String discriminator;

    public QuestionIdGenerator(QuestionProperties properties) {
        this.discriminator = properties.getIdDiscriminator();
    }

    public String deriveId(String questionText) {
        UUID textNamespace = nameBasedUuid(DNS_NAMESPACE, questionText);
        return nameBasedUuid(textNamespace, discriminator).toString();
    }

    static UUID nameBasedUuid(UUID namespace, String name) {
        MessageDigest sha1;
        try {
            sha1 = MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 algorithm not available", e);
        }
        sha1.update(ByteBuffer.allocate(16)
                .putLong(namespace.getMostSignificantBits())
                .putLong(namespace.getLeastSignificantBits())
                .array());
        sha1.update(name.getBytes(StandardCharsets.UTF_8));
        byte[] hash = sha1.digest();

        hash[6] = (byte) ((hash[6] & 0x0f) | 0x50);
        hash[8] = (byte) ((hash[8] & 0x3f) | 0x80);

        ByteBuffer buffer = ByteBuffer.wrap(hash, 0, 16);
        return new UUID(buffer.getLong(), buffer.getLong());
    }
}
