package dev.flowbridge.publish;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.flowbridge.catalog.CatalogLoader;
import dev.flowbridge.engine.FlowTranspiler;
import dev.flowbridge.model.ConversionOutcome;
import dev.flowbridge.model.ConversionSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class DirectoryPublisherTest {

    private static ConversionOutcome.Validated convert(String xml) throws Exception {
        var transpiler = new FlowTranspiler(CatalogLoader.builtInServices(), CatalogLoader.builtInPatterns(),
            ConversionSettings.defaults());
        return (ConversionOutcome.Validated) transpiler.convert(xml);
    }

    @Test
    void writesProcessAndReport(@TempDir Path dir) throws Exception {
        ConversionOutcome.Validated outcome = convert("""
            <FLOW NAME="orders.sync:notify">
              <INVOKE SERVICE="acme.mail:send"/>
              <MAP><MAPCOPY FROM="ghost" TO="subject"/></MAP>
            </FLOW>
            """);
        Path out = dir.resolve("out");
        var publisher = new DirectoryPublisher(out);

        PublishReceipt receipt = publisher.publish(outcome);

        assertThat(receipt.processFile()).isEqualTo(out.resolve("orders.sync_notify.xml"));
        assertThat(receipt.reportFile()).isEqualTo(out.resolve("orders.sync_notify.report.json"));
        assertThat(receipt.readyForUnattendedDeployment()).isFalse();
        assertThat(Files.readString(receipt.processFile()))
            .contains("bns:Component")
            .contains("name=\"orders.sync:notify\"");

        // Verify report content
        JsonNode report = new ObjectMapper().readTree(receipt.reportFile().toFile());
        assertThat(report.get("flow").asText()).isEqualTo("orders.sync:notify");
        assertThat(report.get("aggregateConfidence").asInt()).isEqualTo(receipt.aggregateConfidence());
        assertThat(report.get("readyForUnattendedDeployment").asBoolean()).isFalse();
        assertThat(report.get("warnings")).hasSize(2);
        assertThat(report.get("warnings").get(0).get("type").asText()).isEqualTo("DanglingReference");
        assertThat(report.get("warnings").get(1).get("type").asText()).isEqualTo("UnresolvedInvocation");
        assertThat(report.get("stepConfidence").get("FLOW/INVOKE[0]").asInt()).isZero();
        assertThat(report.get("statistics").get("verbs").get("INVOKE").asInt()).isEqualTo(1);
        assertThat(report.get("validation").get("status").asText()).isEqualTo("VALIDATED");
        assertThat(report.get("validation").get("issues").get(0).get("kind").asText())
            .isEqualTo("UNRESOLVED_PLACEHOLDER");
    }

    @Test
    void sanitizesFlowNamesForFiles() {
        assertThat(DirectoryPublisher.fileName("a.b:c d/e")).isEqualTo("a.b_c_d_e");
        assertThat(DirectoryPublisher.fileName("plain-name_1")).isEqualTo("plain-name_1");
    }

    @Test
    void namesItselfAfterItsDirectory(@TempDir Path dir) {
        assertThat(new DirectoryPublisher(dir).getName()).isEqualTo("directory:" + dir);
    }

    @Test
    void collidingFlowNamesGetDistinctFiles(@TempDir Path dir) throws Exception {
        var publisher = new DirectoryPublisher(dir);
        ConversionOutcome.Validated colon = convert("""
            <FLOW NAME="orders:notify"><MAP><MAPSET FIELD="a">1</MAPSET></MAP></FLOW>
            """);
        ConversionOutcome.Validated underscore = convert("""
            <FLOW NAME="orders_notify"><MAP><MAPSET FIELD="a">1</MAPSET></MAP></FLOW>
            """);

        PublishReceipt first = publisher.publish(colon);
        PublishReceipt second = publisher.publish(underscore);
        PublishReceipt again = publisher.publish(colon);

        assertThat(first.processFile()).isEqualTo(dir.resolve("orders_notify.xml"));
        assertThat(second.processFile()).isEqualTo(dir.resolve("orders_notify-2.xml"));
        assertThat(second.reportFile()).isEqualTo(dir.resolve("orders_notify-2.report.json"));
        assertThat(again.processFile()).isEqualTo(first.processFile());
        assertThat(Files.readString(second.processFile())).contains("name=\"orders_notify\"");
    }
}
