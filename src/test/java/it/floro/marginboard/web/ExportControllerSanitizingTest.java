package it.floro.marginboard.web;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "dashboard.products=Widget Pro,=SUM(A1)")
@AutoConfigureMockMvc
public class ExportControllerSanitizingTest {

    @Autowired
    private MockMvc mvc;

    private String body(String url) throws Exception {
        byte[] bytes = mvc.perform(get(url))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsByteArray();
        return new String(bytes, 3, bytes.length - 3, StandardCharsets.UTF_8);
    }

    @Test
    void formulaLikeProductNamesAreEscaped() throws Exception {
        String grid = body("/export/grid");
        assertTrue(grid.contains("\n'=SUM(A1);2023 Q1;"), grid);
        assertFalse(grid.contains("\n=SUM(A1)"));

        String header = body("/export/chart").split("\n")[0];
        assertEquals("Quarter;Widget Pro;'=SUM(A1);Total Revenue", header);
    }
}
