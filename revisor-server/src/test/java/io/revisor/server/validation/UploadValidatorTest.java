package io.revisor.server.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.WebApplicationException;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class UploadValidatorTest {

    private final UploadValidator validator =
            new UploadValidator(List.of(".py", " .JS ", ".java"), 100);

    @Nested
    class Extensions {

        @Test
        void shouldNormalizeConfiguredExtensions() {
            assertThat(validator.allowedExtensions()).containsExactly(".py", ".js", ".java");
        }

        @Test
        void shouldAcceptAllowedExtensionsCaseInsensitively() {
            assertThatCode(() -> validator.validate("Main.JAVA", 10)).doesNotThrowAnyException();
            assertThatCode(() -> validator.validate("app.js", 10)).doesNotThrowAnyException();
        }

        @Test
        void shouldRejectOtherExtensions() {
            assertThatThrownBy(() -> validator.validate("notes.txt", 10))
                    .isInstanceOf(BadRequestException.class)
                    .hasMessageContaining(".txt")
                    .hasMessageContaining(".py");
        }

        @Test
        void shouldRejectNamesWithoutExtension() {
            assertThatThrownBy(() -> validator.validate("Makefile", 10))
                    .isInstanceOf(BadRequestException.class);
            assertThatThrownBy(() -> validator.validate(".py", 10))
                    .isInstanceOf(BadRequestException.class);
        }

        @Test
        void shouldLookOnlyAtTheLastPathSegment() {
            assertThat(UploadValidator.extensionOf("src.v2/main")).isEmpty();
            assertThat(UploadValidator.extensionOf("dir\\calc.py")).isEqualTo(".py");
        }
    }

    @Nested
    class Size {

        @Test
        void shouldRejectEmptyFile() {
            assertThatThrownBy(() -> validator.validate("a.py", 0))
                    .isInstanceOf(BadRequestException.class)
                    .hasMessage("File is empty");
        }

        @Test
        void shouldAcceptFileAtTheLimit() {
            assertThatCode(() -> validator.validate("a.py", 100)).doesNotThrowAnyException();
        }

        @Test
        void shouldRejectFileAboveTheLimitWith413() {
            assertThatThrownBy(() -> validator.validate("a.py", 101))
                    .isInstanceOf(WebApplicationException.class)
                    .satisfies(
                            e ->
                                    assertThat(
                                                    ((WebApplicationException) e)
                                                            .getResponse()
                                                            .getStatus())
                                            .isEqualTo(413));
        }
    }

    @Test
    void shouldRequireFileName() {
        assertThatThrownBy(() -> validator.validate(null, 10))
                .isInstanceOf(BadRequestException.class)
                .hasMessage("File name is required");
    }
}
