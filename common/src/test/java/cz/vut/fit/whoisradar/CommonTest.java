package cz.vut.fit.whoisradar;

import cz.vut.fit.whoisradar.models.AddressRange;
import cz.vut.fit.whoisradar.models.LookupResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommonTest {

    public static class NamedComponent {
        public static final String COMPONENT_NAME = "named";
    }

    static class UnnamedComponent {
    }

    @Test
    void getComponentLogger_appendsComponentName() {
        var logger = Common.getComponentLogger(NamedComponent.class);
        assertEquals(NamedComponent.class.getName() + ".named", logger.getName());
    }

    @Test
    void getComponentLogger_requiresComponentName() {
        assertThrows(RuntimeException.class, () -> Common.getComponentLogger(UnnamedComponent.class));
    }

    @Test
    void isBlank() {
        assertTrue(Common.isBlank(null));
        assertTrue(Common.isBlank(""));
        assertTrue(Common.isBlank(" \r\n\t"));
        assertFalse(Common.isBlank(" x "));
    }

    @Test
    void makeMapper_readsResultWithUnknownFields() throws Exception {
        var mapper = Common.makeMapper().build();
        var json = """
                {"respondedServers": ["whois.iana.org", "whois.arin.net"], "raw": "x",
                 "organizationName": "Example", "addressRange": "192.0.2.0/24", "queriedAt": 1718000000000}
                """;

        var result = mapper.readValue(json, LookupResult.class);

        assertEquals(List.of("whois.iana.org", "whois.arin.net"), result.respondedServers());
        assertEquals(AddressRange.parse("192.0.2.0/24"), result.addressRange());
        assertFalse(mapper.writeValueAsString(result).contains("queriedAt"));
    }
}
