package com.noodles.opgraph.path;

import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class PathResolverTest {

    private static final List<String> VALID = Arrays.asList(
            "/", "/op", "/container/op", "/a/b/c", "/num-1", "/a/./b", "/a/../b");

    @Test
    public void testIsValidPathRejectsMalformed() {
        assertFalse(PathResolver.isValidPath(null));
        assertFalse(PathResolver.isValidPath(""));
        assertFalse(PathResolver.isValidPath("relative/path"));
        assertFalse(PathResolver.isValidPath("//"));
        assertFalse(PathResolver.isValidPath("/container/"));
        assertFalse(PathResolver.isValidPath("/container//operator"));
        assertFalse(PathResolver.isValidPath("/op\u0000x"));
        assertFalse(PathResolver.isValidPath("/op\nx"));
    }

    @Test
    public void testIsValidPathAcceptsWellFormed() {
        assertTrue(PathResolver.isValidPath("/"));
        assertTrue(PathResolver.isValidPath("/op"));
        assertTrue(PathResolver.isValidPath("/container/operator"));
        assertTrue(PathResolver.isAbsolutePath("/a/b"));
        assertFalse(PathResolver.isAbsolutePath("a/b"));
    }

    @Test
    public void testNormalizePath() {
        assertEquals("/a/b", PathResolver.normalizePath("/a/./b"));
        assertEquals("/b", PathResolver.normalizePath("/a/../b"));
        assertEquals("/", PathResolver.normalizePath("/.."));
        assertEquals("/x", PathResolver.normalizePath("/../../x"));
        assertEquals("/a/b", PathResolver.normalizePath("/a//b/"));
        assertEquals("/", PathResolver.normalizePath(""));
        assertEquals("/", PathResolver.normalizePath(null));
    }

    @Test
    public void testNormalizeIsIdempotentAndValid() {
        for (String p : VALID) {
            String once = PathResolver.normalizePath(p);
            assertTrue(p, PathResolver.isValidPath(once));
            assertEquals(p, once, PathResolver.normalizePath(once));
        }
    }

    @Test
    public void testJoinPath() {
        assertEquals("/a/b/c", PathResolver.joinPath("a", "b", "c"));
        assertEquals("/a/c", PathResolver.joinPath("/a", "b", "../c"));
        assertEquals("/", PathResolver.joinPath());
    }

    @Test
    public void testGetParentPath() {
        assertEquals("/a/b", PathResolver.getParentPath("/a/b/c"));
        assertEquals("/", PathResolver.getParentPath("/op"));
        assertEquals("/", PathResolver.getParentPath("/"));
        assertEquals("/a", PathResolver.getParentPath("/a/b/"));
        assertNull(PathResolver.getParentPath(""));
        assertNull(PathResolver.getParentPath(null));
        assertNull(PathResolver.getParentPath("bare"));
    }

    @Test
    public void testGetBaseName() {
        assertEquals("c", PathResolver.getBaseName("/a/b/c"));
        assertEquals("op", PathResolver.getBaseName("/op"));
        assertEquals("", PathResolver.getBaseName("/"));
    }

    @Test
    public void testGenerateQualifiedPath() {
        assertEquals("/container/num", PathResolver.generateQualifiedPath("num", "/container"));
        assertEquals("/container/num", PathResolver.generateQualifiedPath("num", "container"));
        assertEquals("/num", PathResolver.generateQualifiedPath("num", "/"));
        assertEquals("/num", PathResolver.generateQualifiedPath("num", null));
    }

    @Test
    public void testResolvePath() {
        assertEquals("/other", PathResolver.resolvePath("/other", "/a/b"));
        assertEquals("/x", PathResolver.resolvePath("/a/../x", "/a/b"));
        assertEquals("/a/sibling", PathResolver.resolvePath("sibling", "/a/b"));
        assertEquals("/a/sibling", PathResolver.resolvePath("./sibling", "/a/b"));
        assertEquals("/a/x", PathResolver.resolvePath("../x", "/a/b/c"));
        assertEquals("/top", PathResolver.resolvePath("../../../top", "/a/b"));
        assertNull(PathResolver.resolvePath("", "/a"));
        assertNull(PathResolver.resolvePath(null, "/a"));
        assertNull(PathResolver.resolvePath("x", null));
    }

    @Test
    public void testResolvedPathsAreAbsolute() {
        String[] refs = { "x", "./x", "../x", "../../x", "/abs", "a/b/../c", "." };
        String[] contexts = { "/", "/op", "/a/b", "/a/b/c" };
        for (String ref : refs) {
            for (String ctx : contexts) {
                String r = PathResolver.resolvePath(ref, ctx);
                if (r != null)
                    assertTrue(ref + " from " + ctx, PathResolver.isAbsolutePath(r));
            }
        }
    }

    @Test
    public void testParseHandleId() {
        assertEquals(HandleId.par("field"), PathResolver.parseHandleId("par.field"));
        assertEquals(HandleId.out("val"), PathResolver.parseHandleId("out.val"));
        assertEquals(HandleId.par("a.b"), PathResolver.parseHandleId("par.a.b"));
        assertNull(PathResolver.parseHandleId("/op.par.field"));
        assertNull(PathResolver.parseHandleId(""));
        assertNull(PathResolver.parseHandleId(null));
        assertNull(PathResolver.parseHandleId("operator"));
        assertNull(PathResolver.parseHandleId("par."));
        assertNull(PathResolver.parseHandleId("PAR.field"));
        assertEquals("par.field", HandleId.par("field").toString());
    }

    @Test
    public void testSplitPath() {
        assertEquals(Arrays.asList("/", "a", "b"), PathResolver.splitPath("/a/b"));
        assertEquals(Arrays.asList("/"), PathResolver.splitPath("/"));
    }

    @Test
    public void testContainerRelations() {
        assertTrue(PathResolver.isDirectChild("/box/in", "/box"));
        assertFalse(PathResolver.isDirectChild("/box/inner/op", "/box"));
        assertFalse(PathResolver.isDirectChild("/op", "/"));
        assertTrue(PathResolver.isWithinContainer("/box/inner/op", "/box"));
        assertFalse(PathResolver.isWithinContainer("/boxer", "/box"));
        assertFalse(PathResolver.isWithinContainer("/box", "/box"));
    }

    private static String deepPath(int depth) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < depth; i++)
            sb.append('/').append("s").append(i);
        return sb.toString();
    }

    @Test
    public void testVeryLongPaths() {
        String path = deepPath(600);
        String parent = deepPath(599);

        assertTrue(PathResolver.isValidPath(path));
        assertEquals(path, PathResolver.normalizePath(path));
        assertEquals(path, PathResolver.normalizePath(PathResolver.normalizePath(path)));
        assertEquals(parent, PathResolver.getParentPath(path));
        assertEquals("s599", PathResolver.getBaseName(path));
        assertEquals(parent + "/x", PathResolver.resolvePath("x", path));
        assertEquals(deepPath(598) + "/x", PathResolver.resolvePath("../x", path));
        assertEquals(path, PathResolver.normalizePath(path + "/./a/.."));
    }
}
