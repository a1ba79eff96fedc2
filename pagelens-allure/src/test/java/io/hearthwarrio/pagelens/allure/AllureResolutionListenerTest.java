package io.hearthwarrio.pagelens.allure;

import io.hearthwarrio.pagelens.core.LocatorCandidate;
import io.hearthwarrio.pagelens.core.LogicalTarget;
import io.hearthwarrio.pagelens.core.Resolution;
import io.hearthwarrio.pagelens.core.ResolutionLogDetail;
import io.hearthwarrio.pagelens.core.StrategyTag;
import io.hearthwarrio.pagelens.core.page.Locator;
import io.hearthwarrio.pagelens.core.page.PageNode;
import io.qameta.allure.Allure;
import io.qameta.allure.AllureLifecycle;
import io.qameta.allure.model.Status;
import io.qameta.allure.model.StepResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

public class AllureResolutionListenerTest {

    private AllureLifecycle previous;
    private AllureLifecycle lifecycle;

    @BeforeEach
    void setUp() {
        previous = Allure.getLifecycle();
        lifecycle = mock(AllureLifecycle.class);
        Allure.setLifecycle(lifecycle);
    }

    @AfterEach
    void tearDown() {
        Allure.setLifecycle(previous);
    }

    private static Resolution resolution(StrategyTag strategy) {
        PageNode node = PageNode.builder(7, "span")
                .parent(3, 2)
                .attribute("id", "price")
                .ownText("$19.99")
                .text("$19.99")
                .visible(true)
                .build();
        return new Resolution(
                LogicalTarget.named("price").build(),
                new LocatorCandidate(Locator.css("#price"), strategy, 0.9, 2),
                node
        );
    }

    @Test
    void healedResolutionIsReportedAsStepWithAttachment() throws Exception {
        new AllureResolutionListener(ResolutionLogDetail.LOCATOR, false)
                .onResolved("shop.example", resolution(StrategyTag.TEXT));

        ArgumentCaptor<StepResult> step = ArgumentCaptor.forClass(StepResult.class);
        verify(lifecycle).startStep(anyString(), step.capture());
        assertEquals("Pagelens: price via text (healed)", step.getValue().getName());

        ArgumentCaptor<InputStream> content = ArgumentCaptor.forClass(InputStream.class);
        verify(lifecycle).addAttachment(eq(AllureResolutionListener.ATTACHMENT_NAME), eq("text/plain"), eq(".txt"),
                content.capture());
        String text = new String(content.getValue().readAllBytes(), StandardCharsets.UTF_8);
        assertTrue(text.contains("css: #price"));
        assertTrue(text.contains("healed: true"));
    }

    @Test
    void healedOnlySkipsDirectHits() {
        new AllureResolutionListener(ResolutionLogDetail.LOCATOR, true)
                .onResolved("shop.example", resolution(StrategyTag.DIRECT));

        verify(lifecycle, never()).startStep(anyString(), any(StepResult.class));
    }

    @Test
    void failureIsReportedAsFailedStep() {
        new AllureResolutionListener(ResolutionLogDetail.SUMMARY, false).onFailure(
                "shop.example",
                LogicalTarget.named("warranty").build(),
                List.of(StrategyTag.CACHED, StrategyTag.TEXT, StrategyTag.SEMANTIC)
        );

        ArgumentCaptor<StepResult> step = ArgumentCaptor.forClass(StepResult.class);
        verify(lifecycle).startStep(anyString(), step.capture());
        assertEquals("Pagelens: warranty unresolved on shop.example [cached, text, semantic]", step.getValue().getName());
        assertEquals(Status.FAILED, step.getValue().getStatus());
    }

    @Test
    void summaryOmitsLocator() {
        String text = AllureResolutionListener.describe("shop.example", resolution(StrategyTag.CACHED), ResolutionLogDetail.SUMMARY);

        assertTrue(text.contains("strategy: cached"));
        assertFalse(text.contains("#price"));
    }

    @Test
    void fullDescribesMatchedNode() {
        String text = AllureResolutionListener.describe("shop.example", resolution(StrategyTag.DIRECT), ResolutionLogDetail.FULL);

        assertTrue(text.contains("dom.tag: span"));
        assertTrue(text.contains("dom.id: price"));
        assertTrue(text.contains("dom.name: null"));
    }

    @Test
    void factoryDefaultsToLocatorDetail() {
        assertEquals(ResolutionLogDetail.LOCATOR, PagelensAllureListeners.resolutions().detail());
    }
}
