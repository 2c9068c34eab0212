package works.typelaw.env;

import works.typelaw.types.TypeId;
import works.typelaw.types.TypeParamInfo;

import static java.util.Objects.requireNonNull;

/**
 * The ambient interfaces that give primitives and built-in kinds their members,
 * playing the part of a standard library declaration file.
 *
 * @param rootObject the universal <code>Object</code> interface every non-nullish value satisfies
 * @param arrayElement the type parameter that {@link #array} and {@link #readonlyArray} are written over
 */
public record LibraryTypes(
	TypeId rootObject,
	TypeId function,
	TypeId string,
	TypeId number,
	TypeId booleanType,
	TypeId bigint,
	TypeId symbol,
	TypeParamInfo arrayElement,
	TypeId array,
	TypeId readonlyArray
) {
	public LibraryTypes {
		requireNonNull(rootObject);
		requireNonNull(function);
		requireNonNull(string);
		requireNonNull(number);
		requireNonNull(booleanType);
		requireNonNull(bigint);
		requireNonNull(symbol);
		requireNonNull(arrayElement);
		requireNonNull(array);
		requireNonNull(readonlyArray);
	}
}
