package works.formwork.jackson;

import com.fasterxml.jackson.annotation.JsonFormat;
import java.util.Map;
import tools.jackson.core.JsonGenerator;
import tools.jackson.core.Version;
import tools.jackson.databind.BeanDescription;
import tools.jackson.databind.JacksonModule;
import tools.jackson.databind.JavaType;
import tools.jackson.databind.SerializationConfig;
import tools.jackson.databind.SerializationContext;
import tools.jackson.databind.ValueSerializer;
import tools.jackson.databind.ser.Serializers;
import works.formwork.ErrorReport;
import works.formwork.FormNode;

/**
 * Lets Jackson write forms and their validation results as JSON.
 * <ul>
 *     <li>
 *         A {@link FormNode} is written as its {@link FormNode#snapshot() snapshot}:
 *         an object of property names to values, with nested forms as objects and collections as arrays.
 *     </li>
 *     <li>
 *         An {@link ErrorReport} is written as an object from each error path to its array of messages.
 *     </li>
 * </ul>
 *
 * Reading forms from JSON is done by {@link JsonInput} instead,
 * since populating a form needs the form itself, not a new object.
 */
public class FormworkJacksonModule extends JacksonModule {

	@Override
	public String getModuleName() {
		return getClass().getSimpleName();
	}

	@Override
	public Version version() {
		return Version.unknownVersion();
	}

	@Override
	public void setupModule(SetupContext context) {
		context.addSerializers(new FormSerializers());
	}

	private static final class FormSerializers extends Serializers.Base {
		@Override
		public ValueSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription.Supplier beanDescRef, JsonFormat.Value formatOverrides) {
			Class<?> theClass = type.getRawClass();
			if (FormNode.class.isAssignableFrom(theClass)) {
				return FORM_NODE_SERIALIZER;
			} else if (ErrorReport.class.isAssignableFrom(theClass)) {
				return ERROR_REPORT_SERIALIZER;
			} else {
				return null;
			}
		}
	}

	private static final ValueSerializer<FormNode> FORM_NODE_SERIALIZER = new ValueSerializer<>() {
		@Override
		public void serialize(FormNode value, JsonGenerator gen, SerializationContext serializers) {
			writeMap(value.snapshot(), gen, serializers);
		}
	};

	private static final ValueSerializer<ErrorReport> ERROR_REPORT_SERIALIZER = new ValueSerializer<>() {
		@Override
		public void serialize(ErrorReport value, JsonGenerator gen, SerializationContext serializers) {
			writeMap(value.asMap(), gen, serializers);
		}
	};

	private static void writeMap(Map<String, ?> map, JsonGenerator gen, SerializationContext serializers) {
		serializers
			.findContentValueSerializer(Map.class, null)
			.serialize(map, gen, serializers);
	}
}
