package ai.paper.translator.translate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class PromptTemplateTest {

    @Test
    void substitutesGlossaryAndText() {
        PromptTemplate template = new PromptTemplate("Glossary:\n{glossary}\nText:\n{text}\n");

        assertThat(template.render("- a > b", "hello"))
                .isEqualTo("Glossary:\n- a > b\nText:\nhello\n");
    }

    @Test
    void doesNotExpandPlaceholdersInsideSubstitutedValues() {
        PromptTemplate template = new PromptTemplate("[{glossary}] {text}");

        assertThat(template.render("{text}", "body {glossary}")).isEqualTo("[{text}] body {glossary}");
    }

    @Test
    void academicPromptTargetsKorean() {
        String prompt = PromptTemplate.ACADEMIC_PAPER.render("", "Results are shown in Table 2.");

        assertThat(prompt).contains("into Korean").endsWith("Results are shown in Table 2.\n");
    }

    @Test
    void requiresTextPlaceholder() {
        assertThatThrownBy(() -> new PromptTemplate("only {glossary}"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
