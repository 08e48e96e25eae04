package dk.trustworks.documentassembly.template.model;

import dk.trustworks.documentassembly.template.TemplatePartFilter;

/**
 * One file inside a zip-packaged template.
 *
 * @param name          entry name inside the package, e.g. {@code word/document.xml}
 * @param bytes         entry content
 * @param transformable whether the entry is a document-body XML part that may be rewritten
 */
public record ContainerEntry(String name, byte[] bytes, boolean transformable) {

    public static ContainerEntry of(String name, byte[] bytes) {
        return new ContainerEntry(name, bytes, TemplatePartFilter.isTransformable(name));
    }
}
