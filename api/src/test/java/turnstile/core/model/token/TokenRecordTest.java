package turnstile.core.model.token;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TokenRecord")
class TokenRecordTest {

    @Test
    @DisplayName("should reject a null token")
    void shouldRejectNullToken() {
        assertThrows(NullPointerException.class, () -> new TokenRecord(null, Map.of(), 0));
    }

    @Test
    @DisplayName("should default a null payload to empty")
    void shouldDefaultNullPayload() {
        var record = new TokenRecord("abc", null, 0);

        assertTrue(record.payload().isEmpty());
        assertEquals(Optional.empty(), record.userId());
    }

    @Test
    @DisplayName("should read a string user_id")
    void shouldReadStringUserId() {
        var record = new TokenRecord("abc", Map.of("user_id", "u-1"), 0);

        assertEquals(Optional.of("u-1"), record.userId());
    }

    @Test
    @DisplayName("should render an integral numeric user_id without a fraction")
    void shouldRenderNumericUserId() {
        assertEquals(Optional.of("42"), TokenRecord.userIdOf(Map.of("user_id", 42)));
        assertEquals(Optional.of("42"), TokenRecord.userIdOf(Map.of("user_id", 42L)));
        assertEquals(Optional.of("42"), TokenRecord.userIdOf(Map.of("user_id", 42.0)));
        assertEquals(Optional.of("4.5"), TokenRecord.userIdOf(Map.of("user_id", 4.5)));
    }

    @Test
    @DisplayName("should keep every digit of a user_id beyond the long range")
    void shouldKeepLargeNumericUserId() {
        var big = new BigInteger("123456789012345678901234567890");

        assertEquals(Optional.of("123456789012345678901234567890"), TokenRecord.userIdOf(Map.of("user_id", big)));
        assertEquals(Optional.of("100000000000000000000"), TokenRecord.userIdOf(Map.of("user_id", 1e20)));
        assertEquals(
                Optional.of("9223372036854775807"), TokenRecord.userIdOf(Map.of("user_id", Long.MAX_VALUE)));
    }

    @Test
    @DisplayName("withModifiedAt should keep token and payload")
    void withModifiedAtShouldKeepTokenAndPayload() {
        var record = new TokenRecord("abc", Map.of("user_id", "u-1"), 100);

        var renewed = record.withModifiedAt(200);

        assertEquals("abc", renewed.token());
        assertEquals(record.payload(), renewed.payload());
        assertEquals(200, renewed.modifiedAt());
    }
}
