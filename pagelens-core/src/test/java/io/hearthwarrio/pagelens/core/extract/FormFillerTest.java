package io.hearthwarrio.pagelens.core.extract;

import io.hearthwarrio.pagelens.core.fixture.FixturePageProvider;
import io.hearthwarrio.pagelens.core.page.InteractionDriver;
import io.hearthwarrio.pagelens.core.page.Locator;
import io.hearthwarrio.pagelens.core.page.PageHandle;
import io.hearthwarrio.pagelens.core.page.StealthProvider;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.hearthwarrio.pagelens.core.fixture.FixtureDom.body;
import static io.hearthwarrio.pagelens.core.fixture.FixtureDom.el;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

public class FormFillerTest {

    private static final String URL = "https://club.example/join";

    private final FixturePageProvider provider = new FixturePageProvider().page(URL, "Join", body(
            el("form").id("signup").attr("action", "/join").attr("method", "POST").child(
                    el("input").attr("name", "email").attr("type", "email"),
                    el("input").id("username").attr("placeholder", "Username"),
                    el("input").attr("placeholder", "Your city"),
                    el("select").attr("name", "plan").child(el("option", "basic"), el("option", "pro")),
                    el("input").attr("type", "checkbox").attr("name", "terms"),
                    el("button", "Join").attr("type", "submit")
            ),
            el("form").id("search").child(
                    el("input").attr("name", "q"),
                    el("button", "Go")
            )
    ));
    private final InteractionDriver interactions = Mockito.mock(InteractionDriver.class);
    private final StealthProvider stealth = Mockito.mock(StealthProvider.class);
    private final FormFiller filler = new FormFiller(provider, interactions, stealth, 5000);
    private final PageHandle page = provider.open(URL);

    @Test
    void detectsFormsWithTheirControls() {
        List<FormInfo> forms = filler.detect(page);

        assertEquals(2, forms.size());
        FormInfo signup = forms.get(0);
        assertEquals("signup", signup.getId());
        assertEquals("/join", signup.getAction());
        assertEquals("post", signup.getMethod());
        assertEquals("#signup", signup.getSelector());
        assertEquals(5, signup.getFields().size());
        assertEquals("email", signup.getFields().get(0).getType());
        assertEquals("input", signup.getFields().get(1).getType());
        assertEquals("Your city", signup.getFields().get(2).getPlaceholder());
        assertEquals("select", signup.getFields().get(3).getType());

        FormInfo search = forms.get(1);
        assertEquals("get", search.getMethod());
        assertNull(search.getAction());
    }

    @Test
    void fillsByNameIdAndPlaceholderThenSubmits() throws Exception {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("email", "ann@example.com");
        values.put("username", "ann");
        values.put("city", "Paris");
        values.put("plan", "pro");
        values.put("terms", true);
        values.put("fax", "123");

        FillResult result = filler.fill(page, values, "#signup", true);

        assertEquals(List.of("email", "username", "city", "plan", "terms"), result.getFilledFields());
        assertEquals(List.of("fax"), result.getSkippedFields());
        assertTrue(result.isSubmitted());

        verify(interactions).type(page, Locator.css("#signup [name='email']"), "ann@example.com", true);
        verify(interactions).type(page, Locator.css("#signup #username"), "ann", true);
        verify(interactions).type(page, Locator.css("#signup input[placeholder*='city']"), "Paris", true);
        verify(interactions).select(page, Locator.css("#signup [name='plan']"), "pro");
        verify(interactions).setChecked(page, Locator.css("#signup [name='terms']"), true);
        verify(interactions).click(page, Locator.css("#signup button[type='submit']"));
        verify(stealth, times(5)).humanDelay();
    }

    @Test
    void formSelectorScopesLookups() throws Exception {
        Map<String, Object> values = Map.of("q", "kettle");

        FillResult scoped = filler.fill(page, values, "#signup", false);

        assertEquals(List.of("q"), scoped.getSkippedFields());
        assertFalse(scoped.isSubmitted());
        verify(interactions, never()).type(any(), any(), any(), Mockito.anyBoolean());

        FillResult whole = filler.fill(page, values, null, false);

        assertEquals(List.of("q"), whole.getFilledFields());
    }

    @Test
    void candidateSelectorsSkipIdForNonIdentifierKeys() {
        List<String> selectors = FormFiller.candidateSelectors("", "first name");

        assertEquals(4, selectors.size());
        assertEquals("[name='first name']", selectors.get(0));
        assertEquals("input[placeholder*='first name']", selectors.get(1));
    }
}
