package works.formwork;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.formwork.AlbumModels.Album;
import works.formwork.AlbumModels.Artist;
import works.formwork.AlbumModels.Song;
import works.formwork.exceptions.DefinitionException;
import works.formwork.exceptions.IncompatibleModelException;
import works.formwork.exceptions.MissingAccessorException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.formwork.AlbumModels.ARTIST;
import static works.formwork.AlbumModels.SONG;

class FormNodeTest {
	static final SchemaDefinition ALBUM = SchemaDefinition.builder("album")
		.property("title")
		.nested("artist", ARTIST)
		.collection("songs", SONG)
		.build();

	List<String> journal;
	Album album;

	@BeforeEach
	void setupAlbum() {
		journal = new ArrayList<>();
		album = new Album(journal);
		album.setTitle("Seven and the Ragged Tiger");
		Artist artist = new Artist(journal);
		artist.setName("Duran Duran");
		album.setArtist(artist);
		album.getSongs().add(new Song(journal, "The Reflex"));
		album.getSongs().add(new Song(journal, "Union of the Snake"));
	}

	@Test
	void bind_readsModel() {
		FormNode form = FormNode.bind(ALBUM, album);

		assertEquals("Seven and the Ragged Tiger", form.get("title"));
		assertSame(album, form.model());
		assertEquals("", form.path());
		assertNull(form.parent());

		FormNode artist = form.child("artist");
		assertSame(album.getArtist(), artist.model());
		assertEquals("Duran Duran", artist.get("name"));
		assertEquals("artist", artist.path());
		assertSame(form, artist.parent());

		List<FormNode> songs = form.children("songs");
		assertEquals(2, songs.size());
		assertEquals("The Reflex", songs.get(0).get("title"));
		assertEquals("songs[1]", songs.get(1).path());
		assertSame(album.getSongs().get(1), songs.get(1).model());
		assertFalse(songs.get(0).isCreated());
	}

	@Test
	void bind_nullNestedAndCollection() {
		album.setArtist(null);
		album.setSongs(null);
		FormNode form = FormNode.bind(ALBUM, album);
		assertNull(form.child("artist"));
		assertEquals(List.of(), form.children("songs"));
	}

	@Test
	void bind_defaultValueWhenModelYieldsNull() {
		SchemaDefinition definition = SchemaDefinition.builder("record")
			.property("genre", o -> o.defaultValue("pop"))
			.build();
		Map<String, Object> model = new HashMap<>();
		assertEquals("pop", FormNode.bind(definition, model).get("genre"));
		model.put("genre", "new wave");
		assertEquals("new wave", FormNode.bind(definition, model).get("genre"));
	}

	@Test
	void bind_emptyPropertiesNotRead() {
		// Album has no "confirmation" accessor, nor "reviews"
		SchemaDefinition definition = SchemaDefinition.extend("signup", ALBUM)
			.property("confirmation", o -> o.empty())
			.collection("reviews", SONG, o -> o.empty())
			.build();
		FormNode form = FormNode.bind(definition, album);
		assertNull(form.get("confirmation"));
		assertEquals(List.of(), form.children("reviews"));
	}

	@Test
	void bind_missingReader_throws() {
		SchemaDefinition definition = SchemaDefinition.builder("album")
			.property("label")
			.build();
		MissingAccessorException e = assertThrows(MissingAccessorException.class, () -> FormNode.bind(definition, album));
		assertEquals("label", e.accessorName());
		assertEquals(Album.class, e.modelClass());
	}

	@Test
	void bind_nonIterableCollection_throws() {
		Map<String, Object> model = new HashMap<>();
		model.put("songs", "not a list");
		assertThrows(IncompatibleModelException.class, () -> FormNode.bind(ALBUM, model));
	}

	@Test
	void bind_arrayCollection() {
		Map<String, Object> model = new HashMap<>();
		model.put("songs", new Object[]{ new Song(journal, "A"), new Song(journal, "B") });
		FormNode form = FormNode.bind(ALBUM, model);
		assertEquals(2, form.children("songs").size());
		assertEquals("B", form.children("songs").get(1).get("title"));
	}

	@Test
	void bind_nonSelfOwner_throws() {
		SchemaDefinition definition = SchemaDefinition.builder("album")
			.property("title", o -> o.owner("album"))
			.build();
		assertThrows(DefinitionException.class, () -> FormNode.bind(definition, album));
	}

	@Test
	void compose_dispatchesByOwner() {
		SchemaDefinition definition = SchemaDefinition.builder("albumAndArtist")
			.property("title", o -> o.owner("album"))
			.property("artistName", o -> o.owner("artist").as("name"))
			.build();
		Map<String, Object> models = new LinkedHashMap<>();
		models.put("artist", album.getArtist());
		models.put("album", album);
		FormNode form = FormNode.compose(definition, models);

		assertEquals("Seven and the Ragged Tiger", form.get("title"));
		assertEquals("Duran Duran", form.get("artistName"));
		assertEquals(List.of("album", "artist"), List.copyOf(form.bindings().keySet()));
		assertSame(album, form.model());
		assertSame(album.getArtist(), form.model("artist"));
		assertThrows(IllegalArgumentException.class, () -> form.binding("label"));
	}

	@Test
	void compose_unboundRole_throws() {
		SchemaDefinition definition = SchemaDefinition.builder("albumAndLabel")
			.property("title", o -> o.owner("album"))
			.property("labelName", o -> o.owner("label").as("name"))
			.build();
		assertThrows(DefinitionException.class, () -> FormNode.compose(definition, Map.of("album", album)));
		assertThrows(DefinitionException.class, () -> FormNode.compose(definition, Map.of()));
	}

	@Test
	void compose_nullModel_throws() {
		SchemaDefinition definition = SchemaDefinition.builder("albumAndLabel")
			.property("title", o -> o.owner("album"))
			.property("labelName", o -> o.owner("label").as("name"))
			.build();
		Map<String, Object> models = new HashMap<>();
		models.put("album", album);
		models.put("label", null);
		DefinitionException e = assertThrows(DefinitionException.class, () -> FormNode.compose(definition, models));
		assertThat(e.getMessage(), containsString("label"));
	}

	@Test
	void values_unmodifiable() {
		FormNode form = FormNode.bind(ALBUM, album);
		Map<String, Object> values = form.values();
		assertEquals(List.of("title", "artist", "songs"), List.copyOf(values.keySet()));
		assertThrows(UnsupportedOperationException.class, () -> values.put("title", "x"));
		@SuppressWarnings("unchecked")
		List<FormNode> songs = (List<FormNode>) values.get("songs");
		assertThrows(UnsupportedOperationException.class, songs::clear);
		assertThrows(UnsupportedOperationException.class, () -> form.children("songs").clear());
	}

	@Test
	void set_appliesSetterAndLeavesModel() {
		SchemaDefinition definition = SchemaDefinition.builder("album")
			.property("title", o -> o.setter(v -> v == null ? null : v.toString().trim()))
			.build();
		FormNode form = FormNode.bind(definition, album);
		form.set("title", "  Rio  ");
		assertEquals("Rio", form.get("title"));
		assertEquals("Seven and the Ragged Tiger", album.getTitle());
	}

	@Test
	void set_wrongKind_throws() {
		FormNode form = FormNode.bind(ALBUM, album);
		assertThrows(IllegalArgumentException.class, () -> form.set("songs", List.of()));
		assertThrows(IllegalArgumentException.class, () -> form.set("nope", "x"));
		assertThrows(IllegalArgumentException.class, () -> form.child("songs"));
		assertThrows(IllegalArgumentException.class, () -> form.children("artist"));
	}

	@Test
	void appendAndReplaceChild() {
		FormNode form = FormNode.bind(ALBUM, album);
		Song song = new Song(journal, "New Moon on Monday");
		FormNode appended = form.appendChild("songs", song);
		assertEquals("songs[2]", appended.path());
		assertTrue(appended.isCreated());
		assertEquals("New Moon on Monday", appended.get("title"));
		assertEquals(2, album.getSongs().size());

		Artist artist = new Artist(journal);
		FormNode replaced = form.replaceChild("artist", artist);
		assertSame(replaced, form.child("artist"));
		assertSame(artist, replaced.model());
		assertEquals("Duran Duran", album.getArtist().getName());
	}

	@Test
	void isChanged_tracksDifferencesFromModel() {
		FormNode form = FormNode.bind(ALBUM, album);
		assertFalse(form.isChanged());

		form.set("title", "Seven and the Ragged Tiger");
		assertFalse(form.isChanged("title"));

		form.children("songs").get(1).set("title", "Union");
		assertFalse(form.isChanged("title"));
		assertTrue(form.isChanged("songs"));
		assertTrue(form.isChanged());

		form.sync();
		assertFalse(form.isChanged());

		form.appendChild("songs", new Song(journal));
		assertTrue(form.isChanged("songs"));
		assertFalse(form.isChanged("artist"));
	}

	@Test
	void prepopulate_parentBeforeChildren() {
		List<String> calls = new ArrayList<>();
		SchemaDefinition song = SchemaDefinition.extend("song", SONG)
			.property("title", o -> o.inherit().prepopulator(node -> calls.add("song " + node.path())))
			.build();
		SchemaDefinition definition = SchemaDefinition.builder("album")
			.property("title")
			.collection("songs", song, o -> o.prepopulator(node -> {
				calls.add("album");
				node.appendChild("songs", new Song(journal));
			}))
			.build();
		FormNode form = FormNode.bind(definition, album);
		form.prepopulate();

		assertEquals(List.of("album", "song songs[0]", "song songs[1]", "song songs[2]"), calls);
		assertEquals(3, form.children("songs").size());
		assertTrue(form.children("songs").get(2).isCreated());
		assertEquals(2, album.getSongs().size());
	}

	@Test
	void snapshot_plainNestedData() {
		SchemaDefinition definition = SchemaDefinition.extend("album", ALBUM)
			.property("confirmation", o -> o.empty())
			.build();
		FormNode form = FormNode.bind(definition, album);
		form.set("confirmation", "yes");
		Map<String, Object> snapshot = form.snapshot();

		Map<String, Object> expected = new LinkedHashMap<>();
		expected.put("title", "Seven and the Ragged Tiger");
		expected.put("artist", Map.of("name", "Duran Duran"));
		expected.put("songs", List.of(Map.of("title", "The Reflex"), Map.of("title", "Union of the Snake")));
		expected.put("confirmation", "yes");
		assertEquals(expected, snapshot);
		assertThat(snapshot.get("artist"), instanceOf(Map.class));

		form.set("title", "Rio");
		assertEquals("Seven and the Ragged Tiger", snapshot.get("title"));
	}

	@Test
	void manualSave_leavesModels() {
		FormNode form = FormNode.bind(ALBUM, album);
		form.set("title", "Rio");
		List<Map<String, Object>> saved = new ArrayList<>();
		form.save(saved::add);

		assertEquals(1, saved.size());
		assertEquals("Rio", saved.get(0).get("title"));
		assertEquals("Seven and the Ragged Tiger", album.getTitle());
		assertEquals(List.of(), journal);
	}

	@Test
	void bindings_selfOnly() {
		FormNode form = FormNode.bind(ALBUM, album);
		assertThat(form.bindings().keySet(), contains(PropertyDescriptor.DEFAULT_OWNER));
		assertSame(album, form.binding(PropertyDescriptor.DEFAULT_OWNER).model());
	}
}
