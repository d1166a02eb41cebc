package works.cairn.strict;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import works.cairn.exceptions.ValidationException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TupleOfTest {

	@Test
	void elements_areCoerced() {
		PVector<Long> result = TupleOf.of(Strict.INT).coerce(List.of(1, 2, 3));
		assertEquals(TreePVector.from(List.of(1L, 2L, 3L)), result);
	}

	@Test
	void array_accepted() {
		assertEquals(TreePVector.from(List.of(1L, 2L)), TupleOf.of(Strict.INT).coerce(new int[]{ 1, 2 }));
		assertEquals(TreePVector.from(List.of("a", "b")), TupleOf.of(Strict.STR).coerce(new String[]{ "a", "b" }));
	}

	@Test
	void badElement_throws() {
		assertThrows(ValidationException.class, () -> TupleOf.of(Strict.INT).coerce(List.of(1, "2")));
	}

	@Test
	void nonIterable_throws() {
		assertThrows(ValidationException.class, () -> TupleOf.of(Strict.INT).coerce(1));
		assertThrows(ValidationException.class, () -> TupleOf.plain().coerce(null));
	}

	@Test
	void plain_doesNotValidate() {
		assertEquals(TreePVector.from(List.of(1, "two")), TupleOf.plain().coerce(List.of(1, "two")));
	}

	@Test
	void name_composes() {
		assertEquals("tuple[strictint]", TupleOf.of(Strict.INT).name());
		assertEquals("tuple[tuple[strictstr]]", TupleOf.of(TupleOf.of(Strict.STR)).name());
		assertEquals("tuple", TupleOf.plain().name());
	}

	@Test
	void equality_byName() {
		assertEquals(TupleOf.of(Strict.INT), TupleOf.of(Strict.INT));
		assertEquals(TupleOf.of(Strict.of(Long.class)).hashCode(), TupleOf.of(Strict.of(Long.class)).hashCode());
		assertNotEquals(TupleOf.of(Strict.INT), TupleOf.of(Strict.FLOAT));
		assertNotEquals(TupleOf.of(Strict.INT), TupleOf.plain());
	}
}
