package forcelink.domain.httpclient;

import forcelink.domain.exceptions.UnsupportedMethod;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class HttpMethodTest {

    @Test
    public void testFromName() {
        assertEquals(HttpMethod.GET, HttpMethod.fromName("GET"));
        assertEquals(HttpMethod.POST, HttpMethod.fromName("post"));
        assertEquals(HttpMethod.PATCH, HttpMethod.fromName(" Patch "));
        assertEquals(HttpMethod.DELETE, HttpMethod.fromName("delete"));
    }

    @Test
    public void testUnsupported() {
        final UnsupportedMethod ex = assertThrows(UnsupportedMethod.class, () -> HttpMethod.fromName("PUT"));
        assertEquals("PUT", ex.getMethod());

        assertThrows(UnsupportedMethod.class, () -> HttpMethod.fromName("HEAD"));
        assertThrows(UnsupportedMethod.class, () -> HttpMethod.fromName(""));
        assertThrows(UnsupportedMethod.class, () -> HttpMethod.fromName(null));
    }

    @Test
    public void testHasBody() {
        assertTrue(HttpMethod.POST.hasBody());
        assertTrue(HttpMethod.PATCH.hasBody());
        assertFalse(HttpMethod.GET.hasBody());
        assertFalse(HttpMethod.DELETE.hasBody());
    }

    @Test
    public void testResult() {
        assertTrue(new HttpResult(204, null).isSuccess());
        assertEquals("", new HttpResult(204, null).body());
        assertFalse(new HttpResult(301, "").isSuccess());
        assertFalse(new HttpResult(404, "[]").isSuccess());
    }
}
