package works.typelaw.env;

import java.util.List;
import works.typelaw.types.IndexSignature;
import works.typelaw.types.ObjectShape;
import works.typelaw.types.ParamInfo;
import works.typelaw.types.PropertyInfo;
import works.typelaw.types.TypeFactory;
import works.typelaw.types.TypeId;
import works.typelaw.types.TypeParamInfo;

import static works.typelaw.types.TypeId.ANY;
import static works.typelaw.types.TypeId.BIGINT;
import static works.typelaw.types.TypeId.BOOLEAN;
import static works.typelaw.types.TypeId.NUMBER;
import static works.typelaw.types.TypeId.STRING;
import static works.typelaw.types.TypeId.SYMBOL;
import static works.typelaw.types.TypeId.UNDEFINED;

/**
 * A compact rendition of the standard library interfaces, sufficient for
 * apparent-type lookups when no binder supplies its own.
 */
public final class BuiltinLibrary {
	private final TypeFactory f;

	private BuiltinLibrary(TypeFactory factory) {
		this.f = factory;
	}

	public static LibraryTypes create(TypeFactory factory) {
		return new BuiltinLibrary(factory).build();
	}

	private LibraryTypes build() {
		TypeId function = functionInterface();
		TypeParamInfo element = TypeParamInfo.of("T");
		return new LibraryTypes(
			rootObject(function),
			function,
			stringInterface(),
			numberInterface(),
			booleanInterface(),
			bigintInterface(),
			symbolInterface(),
			element,
			arrayInterface(f.typeParameter(element), false),
			arrayInterface(f.typeParameter(element), true));
	}

	private TypeId rootObject(TypeId function) {
		TypeId propertyKey = f.union(STRING, NUMBER, SYMBOL);
		return f.object(ObjectShape.builder()
			.property("constructor", function)
			.method("toString", method(STRING))
			.method("toLocaleString", method(STRING))
			.method("valueOf", method(TypeId.OBJECT))
			.method("hasOwnProperty", method(BOOLEAN, ParamInfo.of("v", propertyKey)))
			.method("isPrototypeOf", method(BOOLEAN, ParamInfo.of("v", TypeId.OBJECT)))
			.method("propertyIsEnumerable", method(BOOLEAN, ParamInfo.of("v", propertyKey)))
			.build());
	}

	private TypeId functionInterface() {
		return f.object(ObjectShape.builder()
			.method("apply", method(ANY, ParamInfo.of("thisArg", ANY), ParamInfo.optional("argArray", ANY)))
			.method("call", method(ANY, ParamInfo.of("thisArg", ANY), ParamInfo.rest("argArray", f.array(ANY))))
			.method("bind", method(ANY, ParamInfo.of("thisArg", ANY), ParamInfo.rest("argArray", f.array(ANY))))
			.method("toString", method(STRING))
			.readonly("length", NUMBER)
			.readonly("name", STRING)
			.build());
	}

	private TypeId stringInterface() {
		TypeId search = f.method(List.of(ParamInfo.of("searchString", STRING), ParamInfo.optional("position", NUMBER)), NUMBER);
		TypeId test = f.method(List.of(ParamInfo.of("searchString", STRING), ParamInfo.optional("position", NUMBER)), BOOLEAN);
		TypeId pad = method(STRING, ParamInfo.of("maxLength", NUMBER), ParamInfo.optional("fillString", STRING));
		return f.object(ObjectShape.builder()
			.readonly("length", NUMBER)
			.method("charAt", method(STRING, ParamInfo.of("pos", NUMBER)))
			.method("charCodeAt", method(NUMBER, ParamInfo.of("index", NUMBER)))
			.method("concat", method(STRING, ParamInfo.rest("strings", f.array(STRING))))
			.method("indexOf", search)
			.method("lastIndexOf", search)
			.method("includes", test)
			.method("startsWith", test)
			.method("endsWith", test)
			.method("slice", method(STRING, ParamInfo.optional("start", NUMBER), ParamInfo.optional("end", NUMBER)))
			.method("substring", method(STRING, ParamInfo.of("start", NUMBER), ParamInfo.optional("end", NUMBER)))
			.method("split", method(f.array(STRING), ParamInfo.of("separator", STRING), ParamInfo.optional("limit", NUMBER)))
			.method("toLowerCase", method(STRING))
			.method("toUpperCase", method(STRING))
			.method("trim", method(STRING))
			.method("padStart", pad)
			.method("padEnd", pad)
			.method("repeat", method(STRING, ParamInfo.of("count", NUMBER)))
			.method("replace", method(STRING, ParamInfo.of("searchValue", STRING), ParamInfo.of("replaceValue", STRING)))
			.method("toString", method(STRING))
			.method("valueOf", method(STRING))
			.numberIndex(new IndexSignature(STRING, true))
			.build());
	}

	private TypeId numberInterface() {
		TypeId digits = method(STRING, ParamInfo.optional("fractionDigits", NUMBER));
		return f.object(ObjectShape.builder()
			.method("toString", method(STRING, ParamInfo.optional("radix", NUMBER)))
			.method("toFixed", digits)
			.method("toExponential", digits)
			.method("toPrecision", method(STRING, ParamInfo.optional("precision", NUMBER)))
			.method("valueOf", method(NUMBER))
			.method("toLocaleString", method(STRING))
			.build());
	}

	private TypeId booleanInterface() {
		return f.object(ObjectShape.builder()
			.method("valueOf", method(BOOLEAN))
			.build());
	}

	private TypeId bigintInterface() {
		return f.object(ObjectShape.builder()
			.method("toString", method(STRING, ParamInfo.optional("radix", NUMBER)))
			.method("toLocaleString", method(STRING))
			.method("valueOf", method(BIGINT))
			.build());
	}

	private TypeId symbolInterface() {
		return f.object(ObjectShape.builder()
			.method("toString", method(STRING))
			.method("valueOf", method(SYMBOL))
			.readonly("description", f.union(STRING, UNDEFINED))
			.build());
	}

	private TypeId arrayInterface(TypeId t, boolean readonly) {
		TypeId arrayOfT = readonly ? f.readonlyArray(t) : f.array(t);
		ObjectShape.Builder builder = ObjectShape.builder()
			.property(new PropertyInfo("length", NUMBER, NUMBER, false, readonly, false))
			.numberIndex(new IndexSignature(t, readonly))
			.method("join", method(STRING, ParamInfo.optional("separator", STRING)))
			.method("indexOf", method(NUMBER, ParamInfo.of("searchElement", t), ParamInfo.optional("fromIndex", NUMBER)))
			.method("includes", method(BOOLEAN, ParamInfo.of("searchElement", t), ParamInfo.optional("fromIndex", NUMBER)))
			.method("slice", method(f.array(t), ParamInfo.optional("start", NUMBER), ParamInfo.optional("end", NUMBER)))
			.method("concat", method(f.array(t), ParamInfo.rest("items", f.array(arrayOfT))))
			.method("at", method(f.union(t, UNDEFINED), ParamInfo.of("index", NUMBER)))
			.method("toString", method(STRING));
		if (!readonly) {
			builder
				.method("push", method(NUMBER, ParamInfo.rest("items", f.array(t))))
				.method("pop", method(f.union(t, UNDEFINED)))
				.method("reverse", method(f.array(t)));
		}
		return f.object(builder.build());
	}

	private TypeId method(TypeId returnType, ParamInfo... params) {
		return f.method(List.of(params), returnType);
	}
}
