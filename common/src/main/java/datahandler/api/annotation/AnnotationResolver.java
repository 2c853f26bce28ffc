package datahandler.api.annotation;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import datahandler.api.request.HttpGetRequest;
import io.github.classgraph.ClassGraph;
import io.github.classgraph.ScanResult;

public class AnnotationResolver {

    private static final Logger log = LoggerFactory.getLogger(AnnotationResolver.class);
    private static List<Class<?>> httpClasses = new ArrayList<>();

    private AnnotationResolver() {}

    static {
        ClassGraph classGraph = new ClassGraph();
        classGraph.enableClassInfo();
        classGraph.enableAnnotationInfo();
        classGraph.acceptPackages("datahandler.api");
        try (ScanResult result = classGraph.scan()) {
            List<String> httpClassNames = result.getClassesWithAnnotation(Http.class).getNames();
            log.trace("Found http class names: {}", httpClassNames);
            for (String cls : httpClassNames) {
                try {
                    httpClasses.add(Class.forName(cls));
                } catch (Exception e) {
                    log.error("Error loading/creating class: " + cls, e);
                }
            }
        }
        log.trace("Loaded http classes: {}", httpClasses);
    }

    public static List<Class<?>> getHttpClasses() {
        return httpClasses;
    }

    /**
     * Finds the request class bound to the longest route that matches the path.
     *
     * @return a new instance of the request class, or null if no route matches
     */
    public static HttpGetRequest getClassForHttpGet(String path) throws Exception {
        log.trace("Looking for class that support http get at path: {}", path);
        Class<?> match = null;
        int matchLength = -1;
        for (Class<?> c : httpClasses) {
            if (!HttpGetRequest.class.isAssignableFrom(c)) {
                continue;
            }
            for (String route : c.getAnnotation(Http.class).path()) {
                if (matches(route, path) && route.length() > matchLength) {
                    match = c;
                    matchLength = route.length();
                }
            }
        }
        if (match == null) {
            return null;
        }
        log.trace("Returning: {}", match.getName());
        return (HttpGetRequest) match.getDeclaredConstructor().newInstance();
    }

    static boolean matches(String route, String path) {
        if (path.equals(route)) {
            return true;
        }
        return !route.equals("/") && path.startsWith(route + "/");
    }

}
