package com.example.PolicyDesk.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunables for retrieval, session memory, prompting and the FAQ catalog.
 *
 * <p>Bound from {@code policy-desk.*} in {@code application.yml}.</p>
 */
@Data
@Component
@ConfigurationProperties(prefix = "policy-desk")
public class PolicyDeskProperties {

    private Retrieval retrieval = new Retrieval();
    private Memory memory = new Memory();
    private Prompt prompt = new Prompt();
    private Faq faq = new Faq();

    @Data
    public static class Retrieval {

        /** Number of nearest neighbours requested from the vector index. */
        private int topK = 5;

        /** Chunks scoring below this cosine similarity are dropped. */
        private double minScore = 0.5;

        /** Repeated header/footer strings removed from chunk text. */
        private List<String> boilerplate = new ArrayList<>(List.of(
                "Your Health Your Finances Your Eligibility",
                "Your Health Your Finances",
                "Your Eligibility",
                "TESLA, INC. CONFIDENTIAL INFORMATION",
                "TESLA EMPLOYEE HANDBOOK",
                "Your Health Your Family Your Perks"
        ));
    }

    @Data
    public static class Memory {

        /** Question/answer pairs forwarded to generation as conversational context. */
        private int contextPairs = 2;

        /** Length of the first-question preview in session listings. */
        private int previewLength = 30;
    }

    @Data
    public static class Prompt {

        private String system = """
                You are an HR assistant that helps employees understand company policies and benefits.

                Follow these guidelines for your answers:

                ## CONTENT GUIDELINES:
                1. Be accurate, based on the provided HR policy documentation.
                2. Include specific data like dollar amounts, plan names, and coverage tiers when available.
                3. If you don't know the answer, just say that you don't know, don't try to make up an answer.
                4. If the user's current message refers to a previous topic, use the last 2 Q&A pairs to infer the full context.
                   For example, if they previously asked about remote work and now ask "What about interns?", interpret this as asking about
                   remote work policies for interns.

                ## FORMATTING GUIDELINES (VERY IMPORTANT):
                1. Keep answers concise and user-friendly - limit to 2-4 short paragraphs maximum (under 8 sentences total).
                2. Start with a clear, direct answer (yes/no/summary), followed by key details like eligibility or duration.
                3. Use bullet points for comparing options or listing multiple items.
                4. Avoid essay-like structures or long-winded legal text unless explicitly requested.
                5. End with a brief reference suggestion like: "Refer to the Benefits Guide for more details" or "Contact HR for specific eligibility questions."
                """;

        private String contextPreamble = "Use the following information to answer the user's question:";

        /** Persisted as the assistant turn whenever a question cannot be answered. */
        private String apology = "Unable to process your request at this time. "
                + "Please try again or contact HR support for assistance.";
    }

    @Data
    public static class Faq {

        private List<Entry> entries = new ArrayList<>();

        @Data
        public static class Entry {
            private String question;
            private String answer;
        }
    }
}
