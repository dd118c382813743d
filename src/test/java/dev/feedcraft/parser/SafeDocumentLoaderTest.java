package dev.feedcraft.parser;

import dev.feedcraft.exception.ErrorKind;
import dev.feedcraft.exception.RssInputException;
import dev.feedcraft.exception.XmlSyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.w3c.dom.Document;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SafeDocumentLoader")
class SafeDocumentLoaderTest {

    private final SafeDocumentLoader loader = new SafeDocumentLoader();

    @Nested
    @DisplayName("textual screening")
    class Screening {

        @Test
        @DisplayName("should reject null input")
        void shouldRejectNull() {
            assertThatThrownBy(() -> loader.load((String) null))
                    .isInstanceOf(RssInputException.class)
                    .hasMessageContaining("string");
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "\n\t  \r\n"})
        @DisplayName("should reject empty and whitespace-only input")
        void shouldRejectBlank(String input) {
            assertThatThrownBy(() -> loader.load(input))
                    .isInstanceOf(RssInputException.class)
                    .hasMessageContaining("Empty");
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "<?xml version=\"1.0\"?><!DOCTYPE rss SYSTEM \"http://evil/rss.dtd\"><rss/>",
                "<!doctype rss><rss/>",
                "<rss><channel><description><![CDATA[Write <!DOCTYPE html> first]]></description></channel></rss>"
        })
        @DisplayName("should reject any DOCTYPE token, whatever the case or position")
        void shouldRejectDoctype(String input) {
            assertThatThrownBy(() -> loader.load(input))
                    .isInstanceOf(RssInputException.class)
                    .hasMessageContaining("document type");
        }

        @Test
        @DisplayName("should reject entity declarations")
        void shouldRejectEntity() {
            String billionLaughs = "<rss>[<!ENTITY lol \"lol\">]&lol;</rss>";

            assertThatThrownBy(() -> loader.load(billionLaughs))
                    .isInstanceOf(RssInputException.class)
                    .hasMessageContaining("custom entities");
        }

        @Test
        @DisplayName("should default the length limit to 10 MiB")
        void shouldDefaultLengthLimit() {
            assertThat(loader.getMaxDocumentLength()).isEqualTo(10 * 1024 * 1024);
            assertThat(new SafeDocumentLoader(16).getMaxDocumentLength()).isEqualTo(16);
        }

        @Test
        @DisplayName("should reject documents longer than the configured limit")
        void shouldRejectOversizedInput() {
            SafeDocumentLoader small = new SafeDocumentLoader(16);

            assertThatThrownBy(() -> small.load("<rss version=\"2.0\"></rss>"))
                    .isInstanceOf(RssInputException.class)
                    .hasMessageContaining("maximum length");
        }

        @Test
        @DisplayName("should not limit length when the limit is zero")
        void shouldAllowUnlimited() {
            SafeDocumentLoader unlimited = new SafeDocumentLoader(0);

            assertThat(unlimited.load("<rss version=\"2.0\"></rss>").getDocumentElement().getNodeName())
                    .isEqualTo("rss");
        }
    }

    @Nested
    @DisplayName("XML parsing")
    class Parsing {

        @Test
        @DisplayName("should parse a well-formed document after leading whitespace and BOM")
        void shouldParseWellFormed() {
            Document document = loader.load("\uFEFF\n  <?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<rss version=\"2.0\"/>");

            assertThat(document.getDocumentElement().getNodeName()).isEqualTo("rss");
        }

        @Test
        @DisplayName("should report unbalanced tags as a syntax error with position")
        void shouldRejectMalformed() {
            assertThatThrownBy(() -> loader.load("<rss>\n<channel>\n</rss>"))
                    .isInstanceOfSatisfying(XmlSyntaxException.class, e -> {
                        assertThat(e.getKind()).isEqualTo(ErrorKind.XML_SYNTAX);
                        assertThat(e.getLineNumber()).isEqualTo(3);
                        assertThat(e.getColumnNumber()).isPositive();
                    });
        }

        @Test
        @DisplayName("should reject undefined entity references")
        void shouldRejectUndefinedEntity() {
            assertThatThrownBy(() -> loader.load("<rss><title>&nbsp;</title></rss>"))
                    .isInstanceOf(XmlSyntaxException.class);
        }

        @Test
        @DisplayName("should reject non-XML text")
        void shouldRejectPlainText() {
            assertThatThrownBy(() -> loader.load("this is not xml"))
                    .isInstanceOf(XmlSyntaxException.class);
        }
    }

    @Nested
    @DisplayName("load(byte[])")
    class Bytes {

        @Test
        @DisplayName("should decode UTF-8 content")
        void shouldDecodeUtf8() {
            byte[] utf8 = "<rss><title>Café</title></rss>".getBytes(StandardCharsets.UTF_8);

            Document document = loader.load(utf8);

            assertThat(document.getDocumentElement().getTextContent()).isEqualTo("Café");
        }

        @Test
        @DisplayName("should reject bytes that are not UTF-8")
        void shouldRejectInvalidUtf8() {
            byte[] latin1 = {'<', 'r', '>', (byte) 0xE9, (byte) 0xFF, '<', '/', 'r', '>'};

            assertThatThrownBy(() -> loader.load(latin1))
                    .isInstanceOf(RssInputException.class)
                    .hasMessageContaining("UTF-8");
        }

        @Test
        @DisplayName("should reject null bytes")
        void shouldRejectNullBytes() {
            assertThatThrownBy(() -> loader.load((byte[]) null))
                    .isInstanceOf(RssInputException.class);
        }
    }
}
