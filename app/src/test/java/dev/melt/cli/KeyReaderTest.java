package dev.melt.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import dev.melt.app.Key;
import java.io.StringReader;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class KeyReaderTest {

    private static List<Key> decode(String input) throws Exception {
        var reader = new KeyReader(new StringReader(input));
        reader.decode();
        var keys = new ArrayList<Key>();
        Key key;
        while ((key = reader.poll(Duration.ZERO)) != null) {
            keys.add(key);
        }
        return keys;
    }

    @Test
    void printableCharacters() throws Exception {
        assertEquals(List.of(Key.of('j'), Key.of('U'), Key.of(' ')), decode("jU "));
    }

    @Test
    void arrowKeysInBothModes() throws Exception {
        assertEquals(List.of(Key.of(Key.Code.UP), Key.of(Key.Code.DOWN)), decode("\u001b[A\u001bOB"));
    }

    @Test
    void loneEscapeAndEscapeFollowedByKey() throws Exception {
        assertEquals(List.of(Key.of(Key.Code.ESCAPE)), decode("\u001b"));
        assertEquals(List.of(Key.of(Key.Code.ESCAPE), Key.of('q')), decode("\u001bq"));
    }

    @Test
    void unknownSequencesAreDropped() throws Exception {
        assertEquals(List.of(Key.of('k')), decode("\u001b[Ck"));
    }

    @Test
    void enterControlAndBackspace() throws Exception {
        assertEquals(
                List.of(
                        Key.of(Key.Code.ENTER),
                        Key.of(Key.Code.ENTER),
                        Key.ctrl('c'),
                        Key.of(Key.Code.BACKSPACE),
                        Key.of(Key.Code.TAB)),
                decode("\r\n\n\u0003\u007f\t"));
    }

    @Test
    void pollTimesOutWithoutInput() throws Exception {
        assertNull(new KeyReader(new StringReader("")).poll(Duration.ofMillis(10)));
    }
}
