package io.arazzolens.core.ir;

import com.google.common.collect.ImmutableList;
import io.arazzolens.ArazzoFixtures;
import io.arazzolens.core.graph.GraphEdge;
import io.arazzolens.core.graph.GraphNode;
import io.arazzolens.core.graph.GraphNodeKind;
import io.arazzolens.core.graph.TransitionGraph;
import io.arazzolens.core.graph.TransitionGraphBuilder;
import io.arazzolens.core.model.ArazzoDocument;
import io.arazzolens.core.model.Workflow;
import io.arazzolens.core.tree.SourceRange;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class GraphIrEmitterTest {

    private final TransitionGraphBuilder graphBuilder = new TransitionGraphBuilder();
    private final GraphIrEmitter emitter = new GraphIrEmitter();

    private GraphIr emit(final String resource, final String workflowId) {
        ArazzoDocument document = ArazzoFixtures.document(ArazzoFixtures.read(resource));
        Workflow workflow = document.findWorkflow(workflowId).orElseThrow();
        TransitionGraph graph = graphBuilder.buildGraph(workflow, document).getGraph();
        return emitter.toIr(graph);
    }

    @Test
    void testPetPurchaseLabels() {
        // when
        final GraphIr ir = emit(ArazzoFixtures.PET_PURCHASE, "purchasePet");

        // then
        assertThat(ir.getWorkflowId()).isEqualTo("purchasePet");
        assertThat(ir.getNodes())
                .extracting(IrNode::getId, IrNode::getKind, IrNode::getLabel)
                .containsExactly(
                        tuple("input", "input", "Inputs: username, password, petId"),
                        tuple("loginStep", "step", "1. [POST] loginStep"),
                        tuple("getPetStep", "step", "2. [GET] getPetStep"),
                        tuple("output", "output", "Outputs: pet"));
        assertThat(ir.getEdges())
                .extracting(IrEdge::getFrom, IrEdge::getTo, IrEdge::getKind, IrEdge::getLabel)
                .containsExactly(
                        tuple("input", "loginStep", "sequential", null),
                        tuple("loginStep", "getPetStep", "sequential", null),
                        tuple("getPetStep", "output", "sequential", null));
    }

    @Test
    void testErrorSinkAndUnknownMethod() {
        // when
        final GraphIr ir = emit(ArazzoFixtures.ORDER_WITH_RETRIES, "placeOrder");

        // then
        assertThat(ir.getNodes())
                .extracting(IrNode::getId, IrNode::getLabel)
                .containsExactly(
                        tuple("input", "Inputs: cartId"),
                        tuple("createOrder", "1. [POST] createOrder"),
                        tuple("payOrder", "2. payOrder"),
                        tuple("output", "Outputs: orderId"),
                        tuple("errorSink", "Error"));
        assertThat(ir.getEdges())
                .extracting(IrEdge::getKind, IrEdge::getLabel)
                .contains(tuple("failure", "giveUp"), tuple("success", "done"));
    }

    @Test
    void testEqualGraphsGiveEqualIr() {
        // when / then
        assertThat(emit(ArazzoFixtures.PET_PURCHASE, "purchasePet"))
                .isEqualTo(emit(ArazzoFixtures.PET_PURCHASE, "purchasePet"));
    }

    @Test
    void testLabelsComeFromGraphAlone() {
        // given
        final TransitionGraph graph = new TransitionGraph("standalone",
                ImmutableList.of("petId"),
                ImmutableList.of(),
                ImmutableList.of(
                        GraphNode.input(SourceRange.EMPTY),
                        new GraphNode("findPet", GraphNodeKind.STEP, "findPet", 0, "petStore.findPetsByStatus", SourceRange.EMPTY),
                        new GraphNode("steps[1]", GraphNodeKind.STEP, null, 1, null, SourceRange.EMPTY),
                        GraphNode.workflow("checkout", SourceRange.EMPTY),
                        GraphNode.output(SourceRange.EMPTY)),
                ImmutableList.of(GraphEdge.sequential("input", "findPet")));

        // when
        final GraphIr ir = emitter.toIr(graph);

        // then
        assertThat(ir.getNodes())
                .extracting(IrNode::getLabel)
                .containsExactly(
                        "Inputs: petId",
                        "1. [GET] findPet",
                        "2. steps[1]",
                        "Workflow: checkout",
                        "Outputs: none");
    }
}
