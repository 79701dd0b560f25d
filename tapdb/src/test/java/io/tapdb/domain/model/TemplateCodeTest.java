package io.tapdb.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TemplateCodeTest {

    @Test
    void parse_acceptsTrailingSlash() {
        TemplateCode code = TemplateCode.parse("container/plate/fixed-plate-96/1.0/");

        assertEquals("container", code.category());
        assertEquals("plate", code.type());
        assertEquals("fixed-plate-96", code.subtype());
        assertEquals("1.0", code.version());
        assertEquals("container/plate/fixed-plate-96/1.0", code.toString());
        assertEquals("container/plate/fixed-plate-96/1.0/", code.toCanonicalString());
        assertEquals(code, TemplateCode.parse("container/plate/fixed-plate-96/1.0"));
    }

    @Test
    void parse_rejectsWrongShape() {
        assertThrows(IllegalArgumentException.class, () -> TemplateCode.parse("container/plate/1.0"));
        assertThrows(IllegalArgumentException.class, () -> TemplateCode.parse("a/b/c/d/e"));
        assertThrows(IllegalArgumentException.class, () -> TemplateCode.parse("a//c/d"));
        assertThrows(IllegalArgumentException.class, () -> TemplateCode.parse("a/ b/c/d"));
        assertThrows(IllegalArgumentException.class, () -> TemplateCode.parse(null));
    }

    @Test
    void isValidAndNormalize() {
        assertTrue(TemplateCode.isValid(" content/well/standard/1.0/ "));
        assertFalse(TemplateCode.isValid("content/well"));
        assertEquals("content/well/standard/1.0", TemplateCode.normalize(" content/well/standard/1.0/ "));
        assertEquals("", TemplateCode.normalize(null));
    }
}
