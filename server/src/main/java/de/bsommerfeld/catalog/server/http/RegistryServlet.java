package de.bsommerfeld.catalog.server.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.catalog.core.error.CatalogException;
import de.bsommerfeld.catalog.core.error.NotFoundException;
import de.bsommerfeld.catalog.core.model.GroupVersionKind;
import de.bsommerfeld.catalog.core.query.CatalogQuery;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;

/**
 * GET /api/v1/{method}, one endpoint per {@link CatalogQuery} method.
 * Arguments are query parameters; single records come back as JSON objects,
 * streams as newline-delimited JSON. Failures are mapped to 404 (not found),
 * 400 (missing parameter) and 500 with an {@code {"error": ...}} body.
 */
@Singleton
public class RegistryServlet extends HttpServlet {

    private static final Logger LOG = LoggerFactory.getLogger(RegistryServlet.class);
    private static final String JSON = "application/json";
    private static final String NDJSON = "application/x-ndjson";

    private final CatalogQuery query;
    private final ObjectMapper mapper = new ObjectMapper();

    @Inject
    public RegistryServlet(CatalogQuery query) {
        this.query = query;
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        String method = req.getPathInfo() == null ? "" : req.getPathInfo().substring(1);
        try {
            switch (method) {
                case "packages":
                    List<String> names = query.listPackages();
                    writeStream(resp, names.stream().map(this::packageName).toArray());
                    break;
                case "package":
                    writeJson(resp, query.getPackage(param(req, "name")));
                    break;
                case "bundle":
                    writeJson(resp, query.getBundle(param(req, "pkg"), param(req, "channel"),
                            param(req, "csvName")));
                    break;
                case "bundle-for-channel":
                    writeJson(resp, query.getBundleForChannel(param(req, "pkg"), param(req, "channel")));
                    break;
                case "channel-entries-that-replace":
                    writeStream(resp, query.getChannelEntriesThatReplace(param(req, "name")).toArray());
                    break;
                case "bundle-that-replaces":
                    writeJson(resp, query.getBundleThatReplaces(param(req, "name"), param(req, "pkg"),
                            param(req, "channel")));
                    break;
                case "channel-entries-that-provide":
                    writeStream(resp, query.getChannelEntriesThatProvide(gvk(req)).toArray());
                    break;
                case "latest-channel-entries-that-provide":
                    writeStream(resp, query.getLatestChannelEntriesThatProvide(gvk(req)).toArray());
                    break;
                case "bundle-that-provides":
                    writeJson(resp, query.getBundleThatProvides(gvk(req)));
                    break;
                case "bundles":
                    sendBundles(resp);
                    break;
                default:
                    writeError(resp, 404, "unknown method " + method);
            }
        } catch (NotFoundException e) {
            writeError(resp, 404, e.getMessage());
        } catch (IllegalArgumentException e) {
            writeError(resp, 400, e.getMessage());
        } catch (CatalogException e) {
            LOG.error("Request {} failed", req.getRequestURI(), e);
            writeError(resp, 500, e.getMessage());
        }
    }

    /** Bundles are written as they arrive; a failure after the first line ends the stream with an error line. */
    private void sendBundles(HttpServletResponse resp) throws IOException, CatalogException {
        resp.setStatus(200);
        resp.setContentType(NDJSON);
        PrintWriter writer = resp.getWriter();
        try {
            query.sendBundles(bundle -> {
                writer.write(mapper.writeValueAsString(bundle));
                writer.write('\n');
            });
        } catch (CatalogException e) {
            if (!resp.isCommitted()) {
                resp.reset();
                throw e;
            }
            LOG.error("Bundle stream failed after it started", e);
            writer.write(mapper.writeValueAsString(error(e.getMessage())));
            writer.write('\n');
        }
    }

    private ObjectNode packageName(String name) {
        return mapper.createObjectNode().put("name", name);
    }

    private static String param(HttpServletRequest req, String name) {
        String value = req.getParameter(name);
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("missing parameter " + name);
        }
        return value;
    }

    private static GroupVersionKind gvk(HttpServletRequest req) {
        String plural = req.getParameter("plural");
        return new GroupVersionKind(param(req, "group"), param(req, "version"), param(req, "kind"), plural);
    }

    private void writeJson(HttpServletResponse resp, Object value) throws IOException {
        resp.setStatus(200);
        resp.setContentType(JSON);
        resp.getWriter().write(mapper.writeValueAsString(value));
    }

    private void writeStream(HttpServletResponse resp, Object[] values) throws IOException {
        resp.setStatus(200);
        resp.setContentType(NDJSON);
        PrintWriter writer = resp.getWriter();
        for (Object value : values) {
            writer.write(mapper.writeValueAsString(value));
            writer.write('\n');
        }
    }

    private void writeError(HttpServletResponse resp, int status, String message) throws IOException {
        resp.setStatus(status);
        resp.setContentType(JSON);
        resp.getWriter().write(mapper.writeValueAsString(error(message)));
    }

    private ObjectNode error(String message) {
        return mapper.createObjectNode().put("error", message);
    }
}
