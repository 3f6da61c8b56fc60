package sixu.cst;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class LineIndexTest {
	// 'é' is two bytes, U+1D11E is a surrogate pair and four bytes.
	private static final String SOURCE = "a\né𝄞b\n";

	@Test
	void countsBytesAndLines() {
		LineIndex index = new LineIndex(SOURCE);
		assertEquals(10, index.byteLength());
		assertEquals(3, index.lineCount());
		assertEquals(2, index.lineStartOffset(2));
		assertEquals(10, index.lineStartOffset(3));
	}

	@Test
	void columnsCountCodePoints() {
		LineIndex index = new LineIndex(SOURCE);
		assertEquals(new Position(4, 2, 1), index.positionAt(4));
		assertEquals(new Position(8, 2, 2), index.positionAt(8));
		assertEquals(new Position(10, 3, 0), index.positionAt(10));
	}

	@Test
	void bothSurrogateHalvesMapToTheCodePointStart() {
		LineIndex index = new LineIndex(SOURCE);
		assertEquals(new Position(4, 2, 1), index.positionAtChar(3));
		assertEquals(new Position(4, 2, 1), index.positionAtChar(4));
		assertEquals(3, index.charIndexOf(4));
	}

	@Test
	void offsetAtInvertsPositionAndClampsToLineEnd() {
		LineIndex index = new LineIndex(SOURCE);
		assertEquals(8, index.offsetAt(2, 2));
		assertEquals(9, index.offsetAt(2, 99));
		assertEquals(0, index.offsetAt(1, 0));
	}

	@Test
	void rejectsOffsetsOutsideTheDocumentOrInsideACharacter() {
		LineIndex index = new LineIndex(SOURCE);
		assertThrows(IllegalArgumentException.class, () -> index.positionAt(-1));
		assertThrows(IllegalArgumentException.class, () -> index.positionAt(11));
		assertThrows(IllegalArgumentException.class, () -> index.positionAt(3));
		assertThrows(IllegalArgumentException.class, () -> index.lineStartOffset(4));
		assertThrows(IllegalArgumentException.class, () -> index.offsetAt(1, -1));
	}

	@Test
	void emptyDocumentHasOneLine() {
		LineIndex index = new LineIndex("");
		assertEquals(1, index.lineCount());
		assertEquals(Position.START, index.positionAt(0));
	}

	@Test
	void carriageReturnStaysOnItsLine() {
		LineIndex index = new LineIndex("ab\r\ncd");
		assertEquals(new Position(2, 1, 2), index.positionAt(2));
		assertEquals(new Position(4, 2, 0), index.positionAt(4));
	}
}
