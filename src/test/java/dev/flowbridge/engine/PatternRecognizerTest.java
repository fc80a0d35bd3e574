package dev.flowbridge.engine;

import dev.flowbridge.catalog.CatalogLoader;
import dev.flowbridge.catalog.PatternCatalog;
import dev.flowbridge.catalog.ServiceCatalog;
import dev.flowbridge.model.ConversionSettings;
import dev.flowbridge.model.PatternTag;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class PatternRecognizerTest {

    private static ServiceCatalog services;
    private static PatternCatalog patterns;

    private static final String FETCH_ITERATE_SEND = """
        <FLOW NAME="orders:sync">
          <SIGNATURE><FIELD NAME="since" TYPE="string"/></SIGNATURE>
          <INVOKE SERVICE="pub.db:query"><INPUT><MAPCOPY FROM="since" TO="sql"/></INPUT></INVOKE>
          <LOOP INPUT="results">
            <INVOKE SERVICE="pub.client:http"><INPUT><MAPCOPY FROM="results/id" TO="url"/></INPUT></INVOKE>
          </LOOP>
        </FLOW>
        """;

    @BeforeAll
    static void loadCatalogs() throws IOException {
        services = CatalogLoader.builtInServices();
        patterns = CatalogLoader.builtInPatterns();
    }

    private static TaggedFlow recognize(String xml, PatternCatalog catalog, ConversionSettings settings)
            throws FlowParseException {
        AnnotatedFlow annotated = new PipelineTracker(services).track(FlowParser.parse(xml));
        return new PatternRecognizer(catalog, services, settings).recognize(annotated);
    }

    private static TaggedFlow recognize(String xml) throws FlowParseException {
        return recognize(xml, patterns, ConversionSettings.defaults());
    }

    @Test
    void recognizesFetchIterateSend() throws Exception {
        TaggedFlow tagged = recognize(FETCH_ITERATE_SEND);

        assertThat(tagged.patternIds()).containsExactly("fetch-iterate-send");
        PatternTag tag = tagged.tags().get(0);
        assertThat(tag.stepPaths()).containsExactly("FLOW/INVOKE[0]", "FLOW/LOOP[1]");
        assertThat(tag.confidence()).isEqualTo(92);

        // Verify captured values used by the shape templates
        assertThat(tag.captures()).containsKeys("fetch", "loop", "send");
        assertThat(tag.values())
            .containsEntry("fetch.service", "pub.db:query")
            .containsEntry("fetch.connectorType", "database")
            .containsEntry("send.service", "pub.client:http")
            .containsEntry("loop.input", "results");
    }

    @Test
    void loopReadingIterationIndexIsNotCollapsed() throws Exception {
        TaggedFlow tagged = recognize("""
            <FLOW NAME="indexed">
              <INVOKE SERVICE="pub.db:query"/>
              <LOOP INPUT="results">
                <INVOKE SERVICE="pub.client:http">
                  <INPUT><MAPCOPY FROM="results/id" TO="url"/><MAPCOPY FROM="$iteration" TO="n"/></INPUT>
                </INVOKE>
              </LOOP>
            </FLOW>
            """);

        assertThat(tagged.tags()).isEmpty();
    }

    @Test
    void longestMatchWins() throws Exception {
        TaggedFlow tagged = recognize("""
            <FLOW NAME="transfer">
              <INVOKE SERVICE="pub.db:query"/>
              <MAP><MAPCOPY FROM="results" TO="payload"/></MAP>
              <INVOKE SERVICE="pub.client:http"><INPUT><MAPCOPY FROM="payload" TO="data"/></INPUT></INVOKE>
            </FLOW>
            """);

        // lookup-enrich also matches the first two steps
        assertThat(tagged.patternIds()).containsExactly("fetch-transform-send");
        assertThat(tagged.tags().get(0).length()).isEqualTo(3);
    }

    @Test
    void tiesGoToTheTemplateDeclaredFirst() throws Exception {
        PatternCatalog twins = CatalogLoader.loadPatternsFromString("""
            {
              "version": "test",
              "patterns": [
                { "id": "first", "confidence": 90,
                  "sequence": [ { "verb": "MAP", "as": "m", "requires": ["SIMPLE_ASSIGNMENTS"] } ],
                  "shapes": [ { "kind": "MAP", "configuration": { "mappings": "${m.mappings}" } } ] },
                { "id": "second", "confidence": 95,
                  "sequence": [ { "verb": "MAP", "as": "m", "requires": ["SIMPLE_ASSIGNMENTS"] } ],
                  "shapes": [ { "kind": "MAP", "configuration": { "mappings": "${m.mappings}" } } ] }
              ]
            }
            """);

        TaggedFlow tagged = recognize("""
            <FLOW NAME="one"><MAP><MAPSET FIELD="a">1</MAPSET></MAP></FLOW>
            """, twins, ConversionSettings.defaults());

        assertThat(tagged.patternIds()).containsExactly("first");
    }

    @Test
    void danglingReferenceBlocksMatch() throws Exception {
        TaggedFlow tagged = recognize("""
            <FLOW NAME="broken">
              <INVOKE SERVICE="pub.db:query"/>
              <MAP><MAPCOPY FROM="results" TO="a"/><MAPCOPY FROM="ghost" TO="b"/></MAP>
            </FLOW>
            """);

        assertThat(tagged.tags()).isEmpty();
    }

    @Test
    void descendsIntoCompositeStepsWhenNothingMatches() throws Exception {
        TaggedFlow tagged = recognize("""
            <FLOW NAME="wrapped">
              <SEQUENCE>
                <INVOKE SERVICE="pub.db:query"/>
                <LOOP INPUT="results">
                  <INVOKE SERVICE="pub.client:http"><INPUT><MAPCOPY FROM="results" TO="body"/></INPUT></INVOKE>
                </LOOP>
              </SEQUENCE>
            </FLOW>
            """);

        assertThat(tagged.tags()).extracting(PatternTag::firstStepPath)
            .containsExactly("FLOW/SEQUENCE[0]/INVOKE[0]");
        assertThat(tagged.tagStartingAt("FLOW/SEQUENCE[0]/INVOKE[0]")).isPresent();
    }

    @Test
    void patternsBelowConfiguredMinimumAreIgnored() throws Exception {
        var strict = new ConversionSettings(90, 15, 60, 75, 60, 70, 80, 95, 5, 250, 150);

        TaggedFlow tagged = recognize(FETCH_ITERATE_SEND, patterns, strict);

        assertThat(tagged.tags()).isEmpty();
    }

    @Test
    void loweredMinimumAdmitsWeakPatterns() throws Exception {
        PatternCatalog weak = CatalogLoader.loadPatternsFromString("""
            {
              "version": "test",
              "patterns": [
                { "id": "weak-map", "confidence": 70,
                  "sequence": [ { "verb": "MAP", "as": "m", "requires": ["SIMPLE_ASSIGNMENTS"] } ],
                  "shapes": [ { "kind": "MAP", "configuration": { "mappings": "${m.mappings}" } } ] }
              ]
            }
            """);
        String flow = """
            <FLOW NAME="one"><MAP><MAPSET FIELD="a">1</MAPSET></MAP></FLOW>
            """;
        var lenient = new ConversionSettings(90, 15, 60, 75, 60, 70, 80, 65, 5, 250, 150);

        assertThat(recognize(flow, weak, ConversionSettings.defaults()).tags()).isEmpty();
        assertThat(recognize(flow, weak, lenient).patternIds()).containsExactly("weak-map");
    }

    @Test
    void loopCollectingResultsIsNotReplaced() throws Exception {
        TaggedFlow tagged = recognize("""
            <FLOW NAME="orders:sync">
              <INVOKE SERVICE="pub.db:query"/>
              <LOOP INPUT="results" OUTPUT="responses">
                <INVOKE SERVICE="pub.client:http"><INPUT><MAPCOPY FROM="results/id" TO="url"/></INPUT></INVOKE>
              </LOOP>
            </FLOW>
            """);

        assertThat(tagged.patternIds()).doesNotContain("fetch-iterate-send");
    }

    @Test
    void recognitionIsDeterministic() throws Exception {
        TaggedFlow first = recognize(FETCH_ITERATE_SEND);
        TaggedFlow second = recognize(FETCH_ITERATE_SEND);

        assertThat(second.tags()).isEqualTo(first.tags());
    }
}
