package works.cairn.hash;

import org.junit.jupiter.api.Test;
import works.cairn.exceptions.ValidationException;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DigestTest {

	@Test
	void wrap_wrongLength_throws() {
		IllegalStateException e = assertThrows(IllegalStateException.class, () -> Digest.wrap(new byte[Digest.LENGTH - 1]));
		assertThat(e.getMessage(), containsString("digest bytes"));
		assertThrows(IllegalStateException.class, () -> Digest.wrap(new byte[Digest.LENGTH + 1]));
	}

	@Test
	void wrap_exactLength_keepsBytes() {
		byte[] bytes = new byte[Digest.LENGTH];
		bytes[0] = 42;
		Digest digest = Digest.wrap(bytes);
		assertArrayEquals(bytes, digest.bytes());
		assertEquals("2a" + "00".repeat(Digest.LENGTH - 1), digest.hex());
	}

	@Test
	void of_wrongLength_throwsValidation() {
		assertThrows(ValidationException.class, () -> Digest.of(new byte[3]));
	}
}
