package io.hearthwarrio.pagelens.webdriver;

/**
 * JavaScript executed in the page by {@link WebDriverPageProvider}.
 * <p>
 * Element indices are pre-order positions inside {@code body}, the same index space the core expects from
 * {@code PageProvider#snapshot} and {@code PageProvider#evaluate}.
 */
final class DomScripts {

    static final String MODE_ALL = "all";
    static final String MODE_CSS = "css";
    static final String MODE_XPATH = "xpath";

    /**
     * Arguments: mode ({@value #MODE_ALL}, {@value #MODE_CSS}, {@value #MODE_XPATH}), expression, max nodes, max text
     * characters per node. Returns a list of {@code {i, p, d, tag, attrs, own, text, vis}} maps.
     */
    static final String WALK =
            "var mode = arguments[0], expr = arguments[1], max = arguments[2], maxText = arguments[3];" +
            "var body = document.body;" +
            "if (!body) { return []; }" +
            "var wanted = null;" +
            "if (mode === 'css') {" +
            "  wanted = new Set(document.querySelectorAll(expr));" +
            "} else if (mode === 'xpath') {" +
            "  wanted = new Set();" +
            "  var r = document.evaluate(expr, document, null, XPathResult.ORDERED_NODE_SNAPSHOT_TYPE, null);" +
            "  for (var k = 0; k < r.snapshotLength; k++) {" +
            "    var n = r.snapshotItem(k); if (n.nodeType === 1) { wanted.add(n); }" +
            "  }" +
            "}" +
            "if (wanted !== null && wanted.size === 0) { return []; }" +
            "function norm(s) { return (s || '').replace(/\\s+/g, ' ').trim(); }" +
            "function shown(el) {" +
            "  if (el === body) { return true; }" +
            "  var st = window.getComputedStyle(el);" +
            "  if (!st || st.display === 'none' || st.visibility === 'hidden' || st.visibility === 'collapse') { return false; }" +
            "  return el.getClientRects().length > 0;" +
            "}" +
            "var out = [];" +
            "var stack = [[body, -1, 0, true]];" +
            "var index = 0;" +
            "while (stack.length) {" +
            "  var item = stack.pop();" +
            "  var el = item[0];" +
            "  var vis = item[3] && shown(el);" +
            "  var i = index++;" +
            "  if (wanted === null || wanted.has(el)) {" +
            "    var attrs = {};" +
            "    for (var a = 0; a < el.attributes.length; a++) { attrs[el.attributes[a].name] = el.attributes[a].value; }" +
            "    var own = '';" +
            "    for (var c = el.firstChild; c; c = c.nextSibling) { if (c.nodeType === 3) { own += ' ' + c.nodeValue; } }" +
            "    var text = norm(vis && el.innerText !== undefined ? el.innerText : el.textContent);" +
            "    if (text.length > maxText) { text = text.substring(0, maxText); }" +
            "    out.push({i: i, p: item[1], d: item[2], tag: el.tagName.toLowerCase(), attrs: attrs," +
            "              own: norm(own), text: text, vis: vis});" +
            "    if (out.length >= max || (wanted !== null && out.length === wanted.size)) { break; }" +
            "  }" +
            "  var kids = el.children;" +
            "  for (var j = kids.length - 1; j >= 0; j--) { stack.push([kids[j], i, item[2] + 1, vis]); }" +
            "}" +
            "return out;";

    /**
     * Arguments: scope expression (null for body), scope kind. Stores the normalized text of the first match in the
     * page and returns the cursor id.
     */
    static final String OPEN_TEXT =
            "var scope = arguments[0], kind = arguments[1], el = null;" +
            "if (!scope) { el = document.body; }" +
            "else if (kind === 'xpath') {" +
            "  el = document.evaluate(scope, document, null, XPathResult.FIRST_ORDERED_NODE_TYPE, null).singleNodeValue;" +
            "} else { el = document.querySelector(scope); }" +
            "var text = el ? (el.innerText || el.textContent || '').replace(/\\s+/g, ' ').replace(/^ /, '') : '';" +
            "window.__pagelensCursors = window.__pagelensCursors || {};" +
            "var id = 'c' + Date.now().toString(36) + Math.random().toString(36).slice(2);" +
            "window.__pagelensCursors[id] = text;" +
            "return id;";

    /**
     * Arguments: cursor id, offset, max characters.
     */
    static final String READ_TEXT =
            "var t = (window.__pagelensCursors || {})[arguments[0]];" +
            "if (t === undefined) { return ''; }" +
            "return t.substring(arguments[1], arguments[1] + arguments[2]);";

    static final String CLOSE_TEXT =
            "if (window.__pagelensCursors) { delete window.__pagelensCursors[arguments[0]]; }";

    static final String LOCAL_STORAGE_EXPORT =
            "var out = {};" +
            "try { for (var i = 0; i < localStorage.length; i++) { var k = localStorage.key(i); out[k] = localStorage.getItem(k); } }" +
            "catch (e) { }" +
            "return out;";

    static final String LOCAL_STORAGE_IMPORT =
            "var items = arguments[0];" +
            "try { for (var k in items) { localStorage.setItem(k, items[k]); } } catch (e) { return false; }" +
            "return true;";

    static final String SCROLL_TO_BOTTOM =
            "window.scrollTo(0, Math.max(document.body ? document.body.scrollHeight : 0," +
            " document.documentElement.scrollHeight));";

    static final String SCROLL_HEIGHT =
            "return Math.max(document.body ? document.body.scrollHeight : 0, document.documentElement.scrollHeight);";

    static final String JS_CLICK = "arguments[0].click();";

    private DomScripts() {
    }
}
