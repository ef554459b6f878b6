package works.formwork;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import works.formwork.exceptions.DefinitionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.formwork.AlbumModels.SONG;

class SchemaBuilderTest {
	static final SchemaDefinition BASE = SchemaDefinition.builder("base")
		.property("title", o -> o.as("name").setter(v -> v))
		.property("year", o -> o.defaultValue(1982))
		.collection("songs", SONG, o -> o.persist(false))
		.rules(Rules.required("title"))
		.build();

	@Test
	void properties_declarationOrder() {
		assertEquals(List.of("title", "year", "songs"), names(BASE));
		PropertyDescriptor title = BASE.requireProperty("title");
		assertEquals("name", title.accessorName());
		assertEquals(PropertyDescriptor.DEFAULT_OWNER, title.owner());
		assertEquals(PropertyKind.SCALAR, title.kind());
		assertEquals(Visibility.NORMAL, title.visibility());
		assertTrue(title.persist());
		assertSame(SONG, BASE.requireProperty("songs").childSchema());
	}

	@Test
	void duplicateName_throws() {
		SchemaBuilder builder = SchemaDefinition.builder("dup")
			.property("title")
			.property("title");
		assertThrows(DefinitionException.class, builder::build);
	}

	@Test
	void duplicateNameInDerived_throws() {
		assertThrows(DefinitionException.class, () -> SchemaDefinition.extend("derived", BASE)
			.property("year")
			.build());
	}

	@Test
	void replace_discardsOptionsAndKeepsPosition() {
		SchemaDefinition derived = SchemaDefinition.extend("derived", BASE)
			.property("title", o -> o.replace().virtual())
			.build();
		assertEquals(List.of("title", "year", "songs"), names(derived));
		PropertyDescriptor title = derived.requireProperty("title");
		assertEquals("title", title.accessorName());
		assertNull(title.setter());
		assertEquals(Visibility.VIRTUAL_READ_ONLY, title.visibility());
	}

	@Test
	void inherit_keepsUnsetOptions() {
		SchemaDefinition derived = SchemaDefinition.extend("derived", BASE)
			.property("title", o -> o.inherit().empty())
			.build();
		PropertyDescriptor title = derived.requireProperty("title");
		assertEquals("name", title.accessorName());
		assertNotNull(title.setter());
		assertEquals(Visibility.EMPTY_WRITE_ONLY, title.visibility());
	}

	@Test
	void inheritShorthand_keepsKindAndChild() {
		SchemaDefinition derived = SchemaDefinition.extend("derived", BASE)
			.inherit("songs", o -> o.skipIf(InputFragments.allBlank()))
			.build();
		PropertyDescriptor songs = derived.requireProperty("songs");
		assertEquals(PropertyKind.NESTED_COLLECTION, songs.kind());
		assertSame(SONG, songs.childSchema());
		assertFalse(songs.persist());
		assertNotNull(songs.skipIf());
	}

	@Test
	void inheritInlineChild_extendsChildSchema() {
		SchemaDefinition derived = SchemaDefinition.extend("derived", BASE)
			.collection("songs", child -> child.property("length"), o -> o.inherit())
			.build();
		SchemaDefinition songSchema = derived.requireProperty("songs").requireChildSchema();
		assertEquals(List.of("title", "length"), names(songSchema));
		assertEquals("derived.songs", songSchema.name());
		assertFalse(songSchema.rules().check(Map.of()).isEmpty(), "Child rules should be inherited");
	}

	@Test
	void inlineChild_builtWithQualifiedName() {
		SchemaDefinition album = SchemaDefinition.builder("album")
			.nested("artist", artist -> artist.property("name"))
			.build();
		SchemaDefinition artist = album.requireProperty("artist").requireChildSchema();
		assertEquals("album.artist", artist.name());
		assertEquals(List.of("name"), names(artist));
	}

	@Test
	void overrideOfUndeclared_throws() {
		assertThrows(DefinitionException.class, () -> SchemaDefinition.builder("x")
			.property("title", o -> o.inherit())
			.build());
		assertThrows(DefinitionException.class, () -> SchemaDefinition.builder("x")
			.property("title", o -> o.replace())
			.build());
		assertThrows(DefinitionException.class, () -> SchemaDefinition.builder("x")
			.inherit("title", o -> { })
			.build());
	}

	@Test
	void blankName_throws() {
		assertThrows(DefinitionException.class, () -> SchemaDefinition.builder("x").property(" "));
	}

	@Test
	void scalarWithCreationPolicy_throws() {
		assertThrows(DefinitionException.class, () -> SchemaDefinition.builder("x")
			.property("title", o -> o.populateIfEmpty(Object.class))
			.build());
	}

	@Test
	void populateIfEmpty_typeWithoutNoArgConstructor_throws() {
		record Credit(String role, String name) { }
		assertThrows(DefinitionException.class, () -> SchemaDefinition.builder("x")
			.nested("credit", c -> c.property("name"), o -> o.populateIfEmpty(Credit.class))
			.build());
	}

	@Test
	void nestedWithDefaultValue_throws() {
		assertThrows(DefinitionException.class, () -> SchemaDefinition.builder("x")
			.nested("artist", AlbumModels.ARTIST, o -> o.defaultValue("nobody"))
			.build());
	}

	@Test
	void redeclareNestedAsScalar_dropsNestedOptions() {
		SchemaDefinition base = SchemaDefinition.builder("base")
			.nested("artist", AlbumModels.ARTIST, o -> o.populateIfEmpty(AlbumModels.Artist.class))
			.build();
		SchemaDefinition derived = SchemaDefinition.extend("derived", base)
			.property("artist", o -> o.inherit())
			.build();
		PropertyDescriptor artist = derived.requireProperty("artist");
		assertEquals(PropertyKind.SCALAR, artist.kind());
		assertNull(artist.creationPolicy());
		assertNull(artist.childSchema());
	}

	@Test
	void fragments_appliedInOrderWithRules() {
		SchemaFragment timestamps = SchemaFragment.of("timestamps", b -> b
			.property("createdAt")
			.property("updatedAt")
			.rules(Rules.required("createdAt")));
		SchemaFragment audited = SchemaFragment.of("audited", b -> b
			.property("updatedAt", o -> o.inherit().virtual()));
		SchemaDefinition definition = SchemaDefinition.builder("post")
			.property("body")
			.include(timestamps)
			.include(audited)
			.rules(Rules.required("body"))
			.build();

		assertEquals(List.of("body", "createdAt", "updatedAt"), names(definition));
		assertEquals(Visibility.VIRTUAL_READ_ONLY, definition.requireProperty("updatedAt").visibility());
		ErrorReport errors = definition.rules().check(Map.of());
		assertEquals(List.of("createdAt", "body"), List.copyOf(errors.paths()));
	}

	@Test
	void fragmentConflict_throws() {
		SchemaFragment titled = SchemaFragment.of("titled", b -> b.property("title"));
		assertThrows(DefinitionException.class, () -> SchemaDefinition.extend("derived", BASE)
			.include(titled)
			.build());
	}

	@Test
	void extend_combinesRules() {
		SchemaDefinition derived = SchemaDefinition.extend("derived", BASE)
			.property("label")
			.rules(Rules.required("label"))
			.build();
		ErrorReport errors = derived.rules().check(Map.of());
		assertEquals(List.of("title", "label"), List.copyOf(errors.paths()));
	}

	@Test
	void extend_leavesBaseUnchanged() {
		SchemaDefinition.extend("derived", BASE)
			.property("label")
			.property("title", o -> o.replace())
			.build();
		assertEquals(List.of("title", "year", "songs"), names(BASE));
		assertEquals("name", BASE.requireProperty("title").accessorName());
	}

	@Test
	void requireProperty_unknown_throws() {
		assertThrows(IllegalArgumentException.class, () -> BASE.requireProperty("nope"));
		assertNull(BASE.property("nope"));
		assertFalse(BASE.hasProperty("nope"));
	}

	private static List<String> names(SchemaDefinition definition) {
		return definition.properties().stream().map(PropertyDescriptor::name).toList();
	}
}
