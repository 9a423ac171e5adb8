package org.ifcserver.ifc.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 几何与表达（geometry / representation）资源实体。
 * <p>
 * 这些实体创建后不再修改，因此使用 record 表达；实体间的引用在写出时转换为 {@code #label}。
 */
public final class IfcGeometry {

    private IfcGeometry() {
    }

    public enum ProfileType {
        CURVE,
        AREA
    }

    public record CartesianPoint(List<Double> coordinates) implements IfcEntity {
        public CartesianPoint {
            coordinates = List.copyOf(coordinates);
        }

        public static CartesianPoint of(double... values) {
            return new CartesianPoint(toList(values));
        }

        public double x() {
            return coordinates.get(0);
        }

        public double y() {
            return coordinates.get(1);
        }

        public double z() {
            return coordinates.size() > 2 ? coordinates.get(2) : 0.0;
        }

        @Override
        public String stepType() {
            return "IFCCARTESIANPOINT";
        }

        @Override
        public List<Object> stepArguments() {
            return List.of(new ArrayList<Object>(coordinates));
        }
    }

    public record Direction(List<Double> directionRatios) implements IfcEntity {
        public Direction {
            directionRatios = List.copyOf(directionRatios);
        }

        public static Direction of(double... values) {
            return new Direction(toList(values));
        }

        public boolean isZero() {
            for (Double ratio : directionRatios) {
                if (ratio != 0.0) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public String stepType() {
            return "IFCDIRECTION";
        }

        @Override
        public List<Object> stepArguments() {
            return List.of(new ArrayList<Object>(directionRatios));
        }
    }

    public record Axis2Placement2D(CartesianPoint location, Direction refDirection) implements IfcEntity {
        @Override
        public String stepType() {
            return "IFCAXIS2PLACEMENT2D";
        }

        @Override
        public List<Object> stepArguments() {
            return Arrays.asList(location, refDirection);
        }
    }

    public record Axis2Placement3D(CartesianPoint location, Direction axis, Direction refDirection) implements IfcEntity {
        @Override
        public String stepType() {
            return "IFCAXIS2PLACEMENT3D";
        }

        @Override
        public List<Object> stepArguments() {
            return Arrays.asList(location, axis, refDirection);
        }
    }

    public record LocalPlacement(LocalPlacement placementRelTo, Axis2Placement3D relativePlacement) implements IfcEntity {
        @Override
        public String stepType() {
            return "IFCLOCALPLACEMENT";
        }

        @Override
        public List<Object> stepArguments() {
            return Arrays.asList(placementRelTo, relativePlacement);
        }
    }

    public record RectangleProfileDef(
            ProfileType profileType,
            String profileName,
            Axis2Placement2D position,
            double xDim,
            double yDim
    ) implements IfcEntity {
        @Override
        public String stepType() {
            return "IFCRECTANGLEPROFILEDEF";
        }

        @Override
        public List<Object> stepArguments() {
            return Arrays.asList(profileType, profileName, position, xDim, yDim);
        }
    }

    /**
     * 拉伸实体：把平面轮廓 {@code sweptArea} 沿 {@code extrudedDirection} 拉伸 {@code depth}。
     */
    public record ExtrudedAreaSolid(
            RectangleProfileDef sweptArea,
            Axis2Placement3D position,
            Direction extrudedDirection,
            double depth
    ) implements IfcEntity {
        @Override
        public String stepType() {
            return "IFCEXTRUDEDAREASOLID";
        }

        @Override
        public List<Object> stepArguments() {
            return Arrays.asList(sweptArea, position, extrudedDirection, depth);
        }
    }

    public record GeometricRepresentationContext(
            String contextIdentifier,
            String contextType,
            int coordinateSpaceDimension,
            double precision,
            Axis2Placement3D worldCoordinateSystem,
            Direction trueNorth
    ) implements IfcEntity {
        @Override
        public String stepType() {
            return "IFCGEOMETRICREPRESENTATIONCONTEXT";
        }

        @Override
        public List<Object> stepArguments() {
            return Arrays.asList(contextIdentifier, contextType, coordinateSpaceDimension, precision,
                    worldCoordinateSystem, trueNorth);
        }
    }

    public record ShapeRepresentation(
            GeometricRepresentationContext contextOfItems,
            String representationIdentifier,
            String representationType,
            List<IfcEntity> items
    ) implements IfcEntity {
        public ShapeRepresentation {
            items = List.copyOf(items);
        }

        @Override
        public String stepType() {
            return "IFCSHAPEREPRESENTATION";
        }

        @Override
        public List<Object> stepArguments() {
            return Arrays.asList(contextOfItems, representationIdentifier, representationType, new ArrayList<Object>(items));
        }
    }

    public record ProductDefinitionShape(String name, String description, List<ShapeRepresentation> representations)
            implements IfcEntity {
        public ProductDefinitionShape {
            representations = List.copyOf(representations);
        }

        @Override
        public String stepType() {
            return "IFCPRODUCTDEFINITIONSHAPE";
        }

        @Override
        public List<Object> stepArguments() {
            return Arrays.asList(name, description, new ArrayList<Object>(representations));
        }
    }

    private static List<Double> toList(double[] values) {
        List<Double> out = new ArrayList<>(values.length);
        for (double v : values) {
            out.add(v);
        }
        return out;
    }
}
