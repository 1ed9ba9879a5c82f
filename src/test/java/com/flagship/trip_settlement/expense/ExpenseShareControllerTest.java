package com.flagship.trip_settlement.expense;

import com.flagship.trip_settlement.common.exception.GlobalExceptionHandler;
import com.flagship.trip_settlement.config.JacksonConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static com.flagship.trip_settlement.support.TestOutput.printInput;
import static com.flagship.trip_settlement.support.TestOutput.printSuccess;
import static com.flagship.trip_settlement.support.TestOutput.printTestHeader;
import static com.flagship.trip_settlement.support.TestUsers.ALICE;
import static com.flagship.trip_settlement.support.TestUsers.BOB;
import static com.flagship.trip_settlement.support.TestUsers.CAROL;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ExpenseShareControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ExpenseShareController(new ShareCalculator()))
                .setControllerAdvice(new GlobalExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(new JacksonConfig().objectMapper()))
                .build();
    }

    @Test
    @DisplayName("Equal split of 10000 among three gives the remainder to the first participant")
    void equalSplit() throws Exception {
        printTestHeader("API - Share Preview");
        String body = """
                {
                  "total_amount": 10000,
                  "split_type": "equal",
                  "participants": [
                    {"user_id": "%s"},
                    {"user_id": "%s"},
                    {"user_id": "%s"}
                  ]
                }
                """.formatted(ALICE, BOB, CAROL);
        printInput("Body", body);

        mockMvc.perform(post("/api/expenses/shares")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(3))
                .andExpect(jsonPath("$[0].user_id").value(ALICE.toString()))
                .andExpect(jsonPath("$[0].share_amount").value(3334))
                .andExpect(jsonPath("$[1].share_amount").value(3333))
                .andExpect(jsonPath("$[2].share_amount").value(3333))
                .andExpect(jsonPath("$[2].share_type").value("equal"));
        printSuccess("Shares add up to the total");
    }

    @Test
    @DisplayName("Percentages that do not add up to 100 are rejected")
    void badPercentages() throws Exception {
        String body = """
                {
                  "total_amount": 10000,
                  "split_type": "percentage",
                  "participants": [
                    {"user_id": "%s", "share_value": 60},
                    {"user_id": "%s", "share_value": 30}
                  ]
                }
                """.formatted(ALICE, BOB);

        mockMvc.perform(post("/api/expenses/shares")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Percentages must add up to 100, got 90"));
    }

    @Test
    @DisplayName("Non-positive total fails request validation")
    void nonPositiveTotal() throws Exception {
        String body = """
                {"total_amount": 0, "split_type": "equal", "participants": [{"user_id": "%s"}]}
                """.formatted(ALICE);

        mockMvc.perform(post("/api/expenses/shares")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.totalAmount").exists());
    }

    @Test
    @DisplayName("Unknown split type is a malformed request")
    void unknownSplitType() throws Exception {
        String body = """
                {"total_amount": 100, "split_type": "by-mood", "participants": [{"user_id": "%s"}]}
                """.formatted(ALICE);

        mockMvc.perform(post("/api/expenses/shares")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest());
    }
}
