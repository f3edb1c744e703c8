package com.metascan.explorer.modules.jsonapi;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metascan.explorer.config.ExplorerProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CallParamInspectorTest {

    private static final String EMPTY_BLAKE2B_256 = "0e5751c026e543b2e8ab2eb06099daa1d1e5df47778f7787faab45cdf12fe3a8";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CallParamInspector inspector = new CallParamInspector(new ExplorerProperties(
            null, null, null, null, null, null, new ExplorerProperties.Params(8), null));

    @Test
    void blake2bOfEmptyInput() {
        assertEquals(EMPTY_BLAKE2B_256, CallParamInspector.blake2b256("0x"));
    }

    @Test
    void oversizedValueBecomesReference() throws Exception {
        JsonNode params = objectMapper.readTree("""
            [
              {"name":"code","type":"Bytes","value":"0x0102030405","valueRaw":"0x0102030405"},
              {"name":"memo","type":"Bytes","value":"0x01","valueRaw":"0x01"}
            ]
            """);

        inspector.inspect(params, "0xhash");

        JsonNode code = params.get(0);
        assertEquals("0xhash/" + CallParamInspector.blake2b256("0x0102030405"), code.get("value").asText());
        assertEquals(CallParamInspector.DOWNLOADABLE, code.get("type").asText());
        assertEquals("", code.get("valueRaw").asText());
        assertEquals("0x01", params.get(1).get("value").asText());
    }

    @Test
    void wrappedCallArgumentsAreWalked() throws Exception {
        JsonNode params = objectMapper.readTree("""
            [
              {"name":"call","type":"Box<Call>","value":{
                "call_module":"system","call_function":"set_code",
                "call_args":[{"name":"code","type":"Bytes","value":"0xaabbccddee"}]
              }},
              {"name":"calls","type":"Vec<Call>","value":[
                {"name":"code","type":"Bytes","value":"0xaabbccddee"}
              ]}
            ]
            """);

        inspector.inspect(params, "12-1");

        String expected = "12-1/" + CallParamInspector.blake2b256("0xaabbccddee");
        assertEquals(expected, params.get(0).get("value").get("call_args").get(0).get("value").asText());
        assertEquals(expected, params.get(1).get("value").get(0).get("value").asText());
    }
}
