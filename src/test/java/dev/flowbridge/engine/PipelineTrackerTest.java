package dev.flowbridge.engine;

import dev.flowbridge.catalog.CatalogLoader;
import dev.flowbridge.catalog.ServiceCatalog;
import dev.flowbridge.model.*;
import dev.flowbridge.model.ConversionWarning.DanglingReference;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineTrackerTest {

    private static ServiceCatalog services;

    @BeforeAll
    static void loadCatalog() throws IOException {
        services = CatalogLoader.builtInServices();
    }

    private static AnnotatedFlow track(String xml) throws FlowParseException {
        return new PipelineTracker(services).track(FlowParser.parse(xml));
    }

    @Test
    void firstStepSeesTheSignature() throws Exception {
        AnnotatedFlow annotated = track("""
            <FLOW NAME="sig">
              <SIGNATURE><FIELD NAME="orderId" TYPE="string"/><FIELD NAME="order" TYPE="document"/></SIGNATURE>
              <MAP><MAPCOPY FROM="order/id" TO="id"/></MAP>
            </FLOW>
            """);

        StepStates states = annotated.statesOf("FLOW/MAP[0]");
        assertThat(states.before().asMap())
            .containsEntry("orderId", FieldType.STRING)
            .containsEntry("order", FieldType.DOCUMENT)
            .hasSize(2);
        assertThat(annotated.warnings()).isEmpty();
    }

    @Test
    void mapOperationsApplyInOrder() throws Exception {
        AnnotatedFlow annotated = track("""
            <FLOW NAME="ops">
              <SIGNATURE><FIELD NAME="order" TYPE="document"/><FIELD NAME="tmp" TYPE="string"/></SIGNATURE>
              <MAP>
                <MAPCOPY FROM="order" TO="copy"/>
                <MAPSET FIELD="status">NEW</MAPSET>
                <MAPSET FIELD="count" TYPE="stringList">1</MAPSET>
                <MAPCOPY FROM="status" TO="label"/>
                <MAPSET FIELD="header/source">erp</MAPSET>
                <MAPDROP FIELD="tmp"/>
              </MAP>
            </FLOW>
            """);

        PipelineState after = annotated.statesOf("FLOW/MAP[0]").after();
        assertThat(after.typeOf("copy")).contains(FieldType.DOCUMENT);
        assertThat(after.typeOf("status")).contains(FieldType.STRING);
        assertThat(after.typeOf("count")).contains(FieldType.STRING_LIST);
        // later operations see earlier ones
        assertThat(after.typeOf("label")).contains(FieldType.STRING);
        assertThat(after.typeOf("header")).contains(FieldType.DOCUMENT);
        assertThat(after.contains("tmp")).isFalse();
        assertThat(annotated.warnings()).isEmpty();
    }

    @Test
    void invocationAddsCatalogOutputs() throws Exception {
        AnnotatedFlow annotated = track("""
            <FLOW NAME="fetch">
              <SIGNATURE><FIELD NAME="since" TYPE="string"/></SIGNATURE>
              <INVOKE SERVICE="pub.db:query">
                <INPUT><MAPCOPY FROM="since" TO="sql"/></INPUT>
                <OUTPUT><MAPCOPY FROM="results" TO="orders"/></OUTPUT>
              </INVOKE>
            </FLOW>
            """);

        PipelineState after = annotated.statesOf("FLOW/INVOKE[0]").after();
        assertThat(after.typeOf("results")).contains(FieldType.DOCUMENT_LIST);
        assertThat(after.typeOf("orders")).contains(FieldType.DOCUMENT_LIST);
        assertThat(annotated.warnings()).isEmpty();
    }

    @Test
    void uncataloguedServiceOutputsAreUnknownNotDangling() throws Exception {
        AnnotatedFlow annotated = track("""
            <FLOW NAME="custom">
              <INVOKE SERVICE="acme.util:lookup">
                <OUTPUT><MAPCOPY FROM="answer" TO="result"/></OUTPUT>
              </INVOKE>
            </FLOW>
            """);

        PipelineState after = annotated.statesOf("FLOW/INVOKE[0]").after();
        assertThat(after.typeOf("answer")).contains(FieldType.UNKNOWN);
        assertThat(after.typeOf("result")).contains(FieldType.UNKNOWN);
        assertThat(annotated.warnings()).isEmpty();
    }

    @Test
    void recordsDanglingReferencesWithoutFailing() throws Exception {
        AnnotatedFlow annotated = track("""
            <FLOW NAME="dangling">
              <MAP>
                <MAPCOPY FROM="ghost/name" TO="name"/>
                <MAPSET FIELD="greeting">Hello %ghost/name% and %name%</MAPSET>
              </MAP>
              <EXIT SIGNAL="FAILURE" MESSAGE="missing %phantom%"/>
            </FLOW>
            """);

        assertThat(annotated.warnings()).containsExactly(
            new DanglingReference("FLOW/MAP[0]", "ghost"),
            new DanglingReference("FLOW/EXIT[1]", "phantom"));
        assertThat(annotated.warningsAt("FLOW/MAP[0]")).hasSize(1);
        assertThat(annotated.hasDanglingUnder("FLOW")).isTrue();
        // the write still happens
        assertThat(annotated.statesOf("FLOW/MAP[0]").after().contains("name")).isTrue();
    }

    @Test
    void scopedStepsRestoreTheEnclosingPipeline() throws Exception {
        AnnotatedFlow annotated = track("""
            <FLOW NAME="scopes">
              <SIGNATURE><FIELD NAME="input" TYPE="string"/></SIGNATURE>
              <SEQUENCE>
                <MAP><MAPSET FIELD="scratch">x</MAPSET></MAP>
              </SEQUENCE>
              <SEQUENCE PROMOTE="kept">
                <MAP><MAPSET FIELD="kept" TYPE="document">x</MAPSET><MAPSET FIELD="lost">y</MAPSET></MAP>
              </SEQUENCE>
              <MAP><MAPCOPY FROM="scratch" TO="again"/></MAP>
            </FLOW>
            """);

        assertThat(annotated.statesOf("FLOW/SEQUENCE[0]").after().names()).containsExactly("input");
        PipelineState afterPromote = annotated.statesOf("FLOW/SEQUENCE[1]").after();
        assertThat(afterPromote.typeOf("kept")).contains(FieldType.DOCUMENT);
        assertThat(afterPromote.contains("lost")).isFalse();
        assertThat(annotated.warnings()).containsExactly(new DanglingReference("FLOW/MAP[2]", "scratch"));
    }

    @Test
    void emptySequenceLeavesPipelineUnchanged() throws Exception {
        AnnotatedFlow annotated = track("""
            <FLOW NAME="empty">
              <SIGNATURE><FIELD NAME="a" TYPE="string"/></SIGNATURE>
              <SEQUENCE PROMOTE="a"/>
            </FLOW>
            """);

        StepStates states = annotated.statesOf("FLOW/SEQUENCE[0]");
        assertThat(states.after()).isEqualTo(states.before());
    }

    @Test
    void stepsWithoutDropsNeverRemoveVariables() throws Exception {
        AnnotatedFlow annotated = track("""
            <FLOW NAME="monotonic">
              <SIGNATURE><FIELD NAME="items" TYPE="documentList"/><FIELD NAME="tier" TYPE="string"/></SIGNATURE>
              <MAP><MAPSET FIELD="a">1</MAPSET></MAP>
              <LOOP INPUT="items"><MAP><MAPSET FIELD="inner">1</MAPSET></MAP></LOOP>
              <BRANCH SWITCH="tier">
                <CASE LABEL="x"><MAP><MAPSET FIELD="b">1</MAPSET></MAP></CASE>
              </BRANCH>
              <TRY><INVOKE SERVICE="pub.client:http"/></TRY>
              <CATCH><INVOKE SERVICE="pub.flow:getLastError"/></CATCH>
              <REPEAT COUNT="2"><MAP><MAPSET FIELD="c">1</MAPSET></MAP></REPEAT>
            </FLOW>
            """);

        for (StepStates states : annotated.states().values()) {
            assertThat(states.after().names()).containsAll(states.before().names());
        }
    }

    @Test
    void branchCasesDoNotSeeEachOther() throws Exception {
        AnnotatedFlow annotated = track("""
            <FLOW NAME="isolation">
              <SIGNATURE><FIELD NAME="tier" TYPE="string"/></SIGNATURE>
              <BRANCH SWITCH="tier">
                <CASE LABEL="A"><MAP><MAPSET FIELD="x">1</MAPSET></MAP></CASE>
                <CASE LABEL="B"><MAP><MAPCOPY FROM="x" TO="y"/></MAP></CASE>
              </BRANCH>
            </FLOW>
            """);

        assertThat(annotated.warnings())
            .containsExactly(new DanglingReference("FLOW/BRANCH[0]/CASE[B]/MAP[0]", "x"));
        assertThat(annotated.statesOf("FLOW/BRANCH[0]").after().contains("x")).isFalse();
    }

    @Test
    void conflictingPromotedTypesBecomeUnknown() throws Exception {
        AnnotatedFlow annotated = track("""
            <FLOW NAME="merge">
              <SIGNATURE><FIELD NAME="tier" TYPE="string"/></SIGNATURE>
              <BRANCH SWITCH="tier" PROMOTE="result,same">
                <CASE LABEL="A">
                  <MAP><MAPSET FIELD="result" TYPE="string">1</MAPSET><MAPSET FIELD="same">a</MAPSET></MAP>
                </CASE>
                <CASE LABEL="B">
                  <MAP><MAPSET FIELD="result" TYPE="document">1</MAPSET><MAPSET FIELD="same">b</MAPSET></MAP>
                </CASE>
              </BRANCH>
            </FLOW>
            """);

        PipelineState after = annotated.statesOf("FLOW/BRANCH[0]").after();
        assertThat(after.typeOf("result")).contains(FieldType.UNKNOWN);
        assertThat(after.typeOf("same")).contains(FieldType.STRING);
    }

    @Test
    void loopBodySeesElementAndOutputBecomesList() throws Exception {
        AnnotatedFlow annotated = track("""
            <FLOW NAME="loop">
              <SIGNATURE><FIELD NAME="results" TYPE="documentList"/></SIGNATURE>
              <LOOP INPUT="results" OUTPUT="acks">
                <MAP><MAPSET FIELD="acks" TYPE="document">ok</MAPSET></MAP>
              </LOOP>
            </FLOW>
            """);

        PipelineState inside = annotated.statesOf("FLOW/LOOP[0]/MAP[0]").before();
        assertThat(inside.typeOf("results")).contains(FieldType.DOCUMENT);
        assertThat(inside.typeOf(PipelineTracker.ITERATION_VARIABLE)).contains(FieldType.STRING);

        PipelineState after = annotated.statesOf("FLOW/LOOP[0]").after();
        assertThat(after.typeOf("results")).contains(FieldType.DOCUMENT_LIST);
        assertThat(after.typeOf("acks")).contains(FieldType.DOCUMENT_LIST);
        assertThat(after.contains(PipelineTracker.ITERATION_VARIABLE)).isFalse();
    }

    @Test
    void unknownStepPathIsRejected() throws Exception {
        AnnotatedFlow annotated = track("<FLOW NAME=\"x\"/>");

        assertThat(annotated.finalState().size()).isZero();
        assertThatThrownBy(() -> annotated.statesOf("FLOW/MAP[9]"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("FLOW/MAP[9]");
    }
}
