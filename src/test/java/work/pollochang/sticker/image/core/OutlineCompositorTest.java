package work.pollochang.sticker.image.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OutlineCompositorTest {

    private RasterImage createTestImage() {
        RasterImage image = RasterImage.blank(50, 50);
        image.fill(20, 20, 31, 31, 255, 0, 0, 255);
        return image;
    }

    /**
     * 描邊為 2r+1 的方形視窗，角落也會被填滿
     */
    @Test
    void testAddOutline_ShouldPaintRingOfRadius() {
        OutlineCompositor compositor = new OutlineCompositor(3, RgbColor.WHITE, 80);
        RasterImage image = createTestImage();

        RasterImage outlined = compositor.addOutline(image);

        int ring = outlined.index(17, 25);
        assertEquals(255, outlined.alpha(ring));
        assertEquals(RgbColor.WHITE, outlined.color(ring));
        assertEquals(255, outlined.alpha(17, 17));
        assertEquals(0, outlined.alpha(16, 25));
        assertEquals(new RgbColor(255, 0, 0), outlined.color(outlined.index(25, 25)));
        // 輸入影像不變
        assertEquals(0, image.alpha(17, 25));
    }

    @Test
    void testAddOutline_ZeroRadius_ShouldReturnCopy() {
        OutlineCompositor compositor = new OutlineCompositor(0, RgbColor.WHITE, 80);
        RasterImage image = createTestImage();

        RasterImage outlined = compositor.addOutline(image);

        assertNotSame(image, outlined);
        assertTrue(image.sameContent(outlined));
    }

    /**
     * 接近背景色的半透明像素、以及貼著透明區的不透明像素清除；被包住的保留
     */
    @Test
    void testRemoveFringe() {
        OutlineCompositor compositor = new OutlineCompositor(3, RgbColor.WHITE, 80);
        RasterImage image = createTestImage();
        image.setPixel(image.index(20, 22), 30, 230, 30, 255);
        image.setPixel(image.index(25, 25), 30, 230, 30, 255);
        image.setPixel(image.index(19, 25), 30, 230, 30, 128);

        int cleared = compositor.removeFringe(image, RgbColor.GREEN);

        assertEquals(2, cleared);
        assertEquals(0, image.alpha(20, 22));
        assertEquals(0, image.alpha(19, 25));
        assertEquals(255, image.alpha(25, 25));
    }

    @Test
    void testCompositeOver_HalfAlphaOverOpaque() {
        RasterImage out = RasterImage.blank(1, 1);

        OutlineCompositor.compositeOver(out, 0, 255, 0, 0, 128, 255, 255, 255, 255);

        assertEquals(255, out.alpha(0));
        assertEquals(255, out.red(0));
        assertEquals(127, out.green(0));
        assertEquals(127, out.blue(0));
    }

    @Test
    void testNegativeRadius_ShouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> new OutlineCompositor(-1, RgbColor.WHITE, 80));
    }
}
