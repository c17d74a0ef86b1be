package cronarchy.scheduler.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import cronarchy.scheduler.api.Controller.ControllerResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ControllerResponseTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void errorBodyIsValidJsonForAnyMessage() throws Exception {
        String message = "bad \"hook\"\n\tat line 1 \\ \u0001";

        ControllerResponse response = ControllerResponse.error(HttpResponseStatus.BAD_REQUEST, message);

        assertEquals(HttpResponseStatus.BAD_REQUEST, response.status());
        assertEquals("application/json", response.contentType());
        assertEquals(message, mapper.readTree(response.body()).get("error").asText());
    }

    @Test
    void notFoundCarriesMessage() throws Exception {
        ControllerResponse response = ControllerResponse.notFound("unknown instance ghost");

        assertEquals(HttpResponseStatus.NOT_FOUND, response.status());
        assertEquals("unknown instance ghost", mapper.readTree(response.body()).get("error").asText());
    }

    @Test
    void nullMessageGivesEmptyError() throws Exception {
        ControllerResponse response = ControllerResponse.error(HttpResponseStatus.INTERNAL_SERVER_ERROR, null);

        assertEquals("", mapper.readTree(response.body()).get("error").asText());
    }
}
