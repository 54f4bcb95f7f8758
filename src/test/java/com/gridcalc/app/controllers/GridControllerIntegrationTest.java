package com.gridcalc.app.controllers;

import com.gridcalc.app.GridCalcApplication;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests using a running server instance (RANDOM_PORT).
 * These tests verify end-to-end HTTP behavior and JSON handling.
 */
@SpringBootTest(
        classes = GridCalcApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class GridControllerIntegrationTest {

    @LocalServerPort
    int port;

    private final RestTemplate restTemplate = new RestTemplate();

    private String baseUrl() {
        return "http://localhost:" + port + "/grid";
    }

    private long createGrid(String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<Long> response =
                restTemplate.postForEntity(baseUrl(), new HttpEntity<>(body, headers), Long.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertNotNull(response.getBody());
        return response.getBody();
    }

    private void setCell(long gridId, String cellId, String rawValue) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.TEXT_PLAIN);
        restTemplate.exchange(baseUrl() + "/" + gridId + "/cell/" + cellId,
                HttpMethod.PUT, new HttpEntity<>(rawValue, headers), Void.class);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> getGrid(long gridId) {
        return restTemplate.getForObject(baseUrl() + "/" + gridId, Map.class);
    }

    /**
     * Create a grid, fill a block of numbers, and read back aggregates.
     */
    @Test
    void testCreateGridAndEvaluateFormulas() {
        long gridId = createGrid("{\"rows\": 6, \"cols\": 6}");

        setCell(gridId, "A1", "5");
        setCell(gridId, "B1", "10");
        setCell(gridId, "A2", "15");
        setCell(gridId, "B2", "20");
        setCell(gridId, "C1", "=SUM(A1:B2)");
        setCell(gridId, "C2", "=COUNTIF(A1:B2,\">10\")");
        setCell(gridId, "C3", "=SUMIF(A1:B2,\">10\")");
        setCell(gridId, "C4", "=C1/0");

        Map<String, Object> data = getGrid(gridId);
        assertEquals(50.0, ((Number) data.get("C1")).doubleValue());
        assertEquals(2.0, ((Number) data.get("C2")).doubleValue());
        assertEquals(35.0, ((Number) data.get("C3")).doubleValue());
        assertEquals("Division by zero", data.get("C4"));
    }

    @Test
    void testCellViewAndDependencies() {
        long gridId = createGrid("{}");
        setCell(gridId, "A1", "=B1");
        setCell(gridId, "B1", "=A1");

        @SuppressWarnings("unchecked")
        Map<String, Object> cell = restTemplate.getForObject(baseUrl() + "/" + gridId + "/cell/A1", Map.class);
        assertNotNull(cell);
        assertEquals("FORMULA", cell.get("kind"));
        assertEquals("=B1", cell.get("rawValue"));
        assertEquals("Cyclic dependency detected", cell.get("error"));

        @SuppressWarnings("unchecked")
        Map<String, Object> dependencies =
                restTemplate.getForObject(baseUrl() + "/" + gridId + "/dependencies", Map.class);
        assertNotNull(dependencies);
        assertEquals(List.of("B1"), dependencies.get("A1"));
        assertEquals(List.of("A1"), dependencies.get("B1"));
    }

    @Test
    void testEmptyCellViewOmitsValueAndError() {
        long gridId = createGrid("{}");

        @SuppressWarnings("unchecked")
        Map<String, Object> cell = restTemplate.getForObject(baseUrl() + "/" + gridId + "/cell/C3", Map.class);
        assertNotNull(cell);
        assertEquals("EMPTY", cell.get("kind"));
        assertFalse(cell.containsKey("value"));
        assertFalse(cell.containsKey("error"));
    }

    @Test
    void testInsertRow() {
        long gridId = createGrid("{}");
        setCell(gridId, "A1", "hello");

        restTemplate.postForEntity(baseUrl() + "/" + gridId + "/rows?at=0", null, Void.class);

        Map<String, Object> data = getGrid(gridId);
        assertEquals("hello", data.get("A2"));
        assertFalse(data.containsKey("A1"));
    }

    @Test
    void testErrorResponses() {
        HttpClientErrorException notFound = assertThrows(HttpClientErrorException.class,
                () -> restTemplate.getForObject(baseUrl() + "/999999", Map.class));
        assertEquals(HttpStatus.NOT_FOUND, notFound.getStatusCode());
        assertTrue(notFound.getResponseBodyAsString().contains("GRID_NOT_FOUND"));

        long gridId = createGrid("{}");
        HttpClientErrorException badCell = assertThrows(HttpClientErrorException.class,
                () -> setCell(gridId, "ZZ9", "1"));
        assertEquals(HttpStatus.BAD_REQUEST, badCell.getStatusCode());
        assertTrue(badCell.getResponseBodyAsString().contains("INVALID_CELL_REFERENCE"));
    }
}
